package com.work.provenance.core.service;

import com.work.provenance.core.clock.LedgerClock;
import com.work.provenance.core.config.LedgerConfig;
import com.work.provenance.core.crypto.DelegatePayload;
import com.work.provenance.core.crypto.RevokePayload;
import com.work.provenance.core.crypto.SignatureVerifier;
import com.work.provenance.core.event.EventRecorder;
import com.work.provenance.core.exception.InvalidInputException;
import com.work.provenance.core.exception.UnauthorizedException;
import com.work.provenance.core.execution.LedgerExecutor;
import com.work.provenance.core.model.Grant;
import com.work.provenance.core.model.LedgerEventType;
import com.work.provenance.core.model.Scope;
import com.work.provenance.core.repository.GrantRepository;
import com.work.provenance.core.repository.NonceRepository;
import com.work.provenance.core.support.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Optional;

import static com.work.provenance.core.event.EventRecorder.fields;
import static com.work.provenance.core.support.ValidationUtils.isZeroBytes32;
import static com.work.provenance.core.support.ValidationUtils.requireAddress;
import static com.work.provenance.core.support.ValidationUtils.requireBytes32;
import static com.work.provenance.core.support.ValidationUtils.requireNonNull;
import static com.work.provenance.core.support.ValidationUtils.requireNonZeroAddress;
import static com.work.provenance.core.support.ValidationUtils.requireNonZeroBytes32;
import static com.work.provenance.core.support.ValidationUtils.requireUint256;

/**
 * 能力委托引擎：principal 通过离线签名授权 relayer 在某个 context 内代为执行指定能力。
 * <p>
 * 约束：
 * 1. 每个 (principal, relayer, context) 最多一条有效授权，重复注册覆盖旧值
 * 2. 授权在 now &lt; expiry 期间有效，过期后被动失效，不需要清理
 * 3. 注册与签名撤销共用同一个 nonce 计数器，任何一次成功都会使此前准备好的其他签名失效
 * 4. scopeMask 恰好等于 {@link Scope#ALL} 时为通配，否则按位与判断
 */
public class DelegationEngine {

    private static final Logger log = LoggerFactory.getLogger(DelegationEngine.class);

    public static final String NONCE_REGISTRY = "delegation";

    private final GrantRepository grantRepository;
    private final LedgerExecutor executor;
    private final EventRecorder eventRecorder;
    private final LedgerClock clock;
    private final LedgerConfig config;
    private final LedgerMetrics metrics;
    private final SignedRequestSupport signed;

    public DelegationEngine(GrantRepository grantRepository,
                            NonceRepository nonceRepository,
                            SignatureVerifier signatureVerifier,
                            EventRecorder eventRecorder,
                            LedgerExecutor executor,
                            LedgerClock clock,
                            LedgerConfig config,
                            LedgerMetrics metrics) {
        this.grantRepository = grantRepository;
        this.executor = executor;
        this.eventRecorder = eventRecorder;
        this.clock = clock;
        this.config = config;
        this.metrics = metrics;
        this.signed = new SignedRequestSupport(signatureVerifier, nonceRepository, metrics);
    }

    /**
     * 授权查询。零 context、无授权、已过期都返回 false，而不是抛异常。
     */
    public boolean isAuthorized(String principal, String relayer, BigInteger capability, String context) {
        String p = requireAddress(principal, "principal");
        String r = requireAddress(relayer, "relayer");
        requireUint256(capability, "capability");
        String ctx = requireBytes32(context, "context");
        if (isZeroBytes32(ctx)) {
            return false;
        }
        Optional<Grant> found = grantRepository.find(p, r, ctx);
        if (!found.isPresent()) {
            return false;
        }
        Grant grant = found.get();
        if (grant.isVoid() || grant.getExpiry() <= clock.now()) {
            return false;
        }
        if (Scope.ALL.equals(grant.getScopeMask())) {
            return true;
        }
        return grant.getScopeMask().and(capability).signum() != 0;
    }

    public boolean isAuthorized(String principal, String relayer, Scope capability, String context) {
        requireNonNull(capability, "capability");
        return isAuthorized(principal, relayer, capability.mask(), context);
    }

    /**
     * 消费方的统一守卫：acting 就是 principal 本人，或持有 principal 在该 context 下授予的对应能力。
     *
     * @throws UnauthorizedException 两者都不满足时
     */
    public void requireActingFor(String acting, String principal, Scope capability, String context) {
        String a = requireNonZeroAddress(acting, "acting");
        String p = requireNonZeroAddress(principal, "principal");
        if (a.equals(p)) {
            return;
        }
        if (!isAuthorized(p, a, capability, context)) {
            metrics.authorizationDenied(capability.name());
            throw new UnauthorizedException("not authorized",
                    a + " 无权代表 " + p + " 执行 " + capability + "，context=" + context);
        }
    }

    /**
     * 通过 principal 的离线签名注册（或覆盖）授权。
     */
    public Grant registerGrant(String principal,
                               String relayer,
                               String context,
                               BigInteger scopeMask,
                               long expiry,
                               long deadline,
                               String signature) {
        String p = requireNonZeroAddress(principal, "principal");
        String r = requireNonZeroAddress(relayer, "relayer");
        String ctx = requireNonZeroBytes32(context, "context");
        BigInteger scopes = requireUint256(scopeMask, "scopeMask");

        return executor.execute("registerGrant", () -> {
            long now = clock.now();
            signed.requireNotExpired("registerGrant", deadline, now);
            if (expiry <= now) {
                throw InvalidInputException.badExpiry(expiry, now);
            }
            long nonce = signed.currentNonce(NONCE_REGISTRY, p);
            DelegatePayload payload = new DelegatePayload(p, r, ctx, scopes, nonce, expiry, deadline);
            signed.requireSigner("registerGrant", config.getDelegationDomain(), payload, signature, p);

            signed.advanceNonce("registerGrant", NONCE_REGISTRY, p, nonce);
            Grant grant = new Grant(p, r, ctx, scopes, expiry);
            grantRepository.save(grant);
            eventRecorder.record(LedgerEventType.DELEGATED, now, fields(
                    "owner", p,
                    "relayer", r,
                    "contextId", ctx,
                    "scopes", scopes.toString(),
                    "expiry", expiry));
            metrics.stateCommitted("registerGrant");
            log.info("grant registered principal={} relayer={} context={} scopes=0x{} expiry={} nonce={}",
                    p, r, ctx, scopes.toString(16), expiry, nonce);
            return grant;
        });
    }

    /**
     * principal 本人直接撤销。不要求授权存在，也不消耗 nonce。
     */
    public void revoke(String acting, String relayer, String context) {
        String p = requireNonZeroAddress(acting, "acting");
        String r = requireNonZeroAddress(relayer, "relayer");
        String ctx = requireNonZeroBytes32(context, "context");
        executor.execute("revoke", () -> {
            voidGrant(p, r, ctx, clock.now());
            log.info("grant revoked principal={} relayer={} context={}", p, r, ctx);
        });
    }

    /**
     * 通过 principal 的离线签名撤销，消耗共享 nonce。
     */
    public void revokeWithSig(String principal, String relayer, String context, long deadline, String signature) {
        String p = requireNonZeroAddress(principal, "principal");
        String r = requireNonZeroAddress(relayer, "relayer");
        String ctx = requireNonZeroBytes32(context, "context");
        executor.execute("revokeWithSig", () -> {
            long now = clock.now();
            signed.requireNotExpired("revokeWithSig", deadline, now);
            long nonce = signed.currentNonce(NONCE_REGISTRY, p);
            RevokePayload payload = new RevokePayload(p, r, ctx, nonce, deadline);
            signed.requireSigner("revokeWithSig", config.getDelegationDomain(), payload, signature, p);

            signed.advanceNonce("revokeWithSig", NONCE_REGISTRY, p, nonce);
            voidGrant(p, r, ctx, now);
            log.info("grant revoked by signature principal={} relayer={} context={} nonce={}", p, r, ctx, nonce);
        });
    }

    private void voidGrant(String principal, String relayer, String context, long now) {
        grantRepository.save(Grant.voided(principal, relayer, context));
        eventRecorder.record(LedgerEventType.REVOKED, now, fields(
                "owner", principal,
                "relayer", relayer,
                "contextId", context));
        metrics.stateCommitted("revoke");
    }

    public long nonceOf(String principal) {
        return signed.currentNonce(NONCE_REGISTRY, requireAddress(principal, "principal"));
    }

    public Optional<Grant> getGrant(String principal, String relayer, String context) {
        return grantRepository.find(
                requireAddress(principal, "principal"),
                requireAddress(relayer, "relayer"),
                requireBytes32(context, "context"));
    }
}
