package com.work.provenance.core.service;

import com.work.provenance.core.clock.LedgerClock;
import com.work.provenance.core.config.LedgerConfig;
import com.work.provenance.core.crypto.SetAuthorityPayload;
import com.work.provenance.core.crypto.SetMemberPayload;
import com.work.provenance.core.crypto.SignatureVerifier;
import com.work.provenance.core.event.EventRecorder;
import com.work.provenance.core.exception.PreconditionFailedException;
import com.work.provenance.core.execution.LedgerExecutor;
import com.work.provenance.core.model.LedgerEventType;
import com.work.provenance.core.repository.NonceRepository;
import com.work.provenance.core.repository.WorkspaceRepository;
import com.work.provenance.core.support.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static com.work.provenance.core.event.EventRecorder.fields;
import static com.work.provenance.core.support.ValidationUtils.isZeroBytes32;
import static com.work.provenance.core.support.ValidationUtils.requireAddress;
import static com.work.provenance.core.support.ValidationUtils.requireBytes32;
import static com.work.provenance.core.support.ValidationUtils.requireNonZeroAddress;
import static com.work.provenance.core.support.ValidationUtils.requireNonZeroBytes32;

/**
 * workspace 注册表：每个 context 一个 authority 和一组成员。
 * <p>
 * 约束：
 * 1. authority 由 initAuthority 一次性设置，之后只能凭当前 authority 的签名轮换
 * 2. authority 始终是成员，不能被移除也不能主动退出
 * 3. 签名使用独立的 EIP-712 域和独立的 nonce 计数器，与委托引擎互不影响
 */
public class WorkspaceRegistry implements WorkspaceMembership {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceRegistry.class);

    public static final String NONCE_REGISTRY = "workspace";

    private final WorkspaceRepository workspaceRepository;
    private final LedgerExecutor executor;
    private final EventRecorder eventRecorder;
    private final LedgerClock clock;
    private final LedgerConfig config;
    private final LedgerMetrics metrics;
    private final SignedRequestSupport signed;

    public WorkspaceRegistry(WorkspaceRepository workspaceRepository,
                             NonceRepository nonceRepository,
                             SignatureVerifier signatureVerifier,
                             EventRecorder eventRecorder,
                             LedgerExecutor executor,
                             LedgerClock clock,
                             LedgerConfig config,
                             LedgerMetrics metrics) {
        this.workspaceRepository = workspaceRepository;
        this.executor = executor;
        this.eventRecorder = eventRecorder;
        this.clock = clock;
        this.config = config;
        this.metrics = metrics;
        this.signed = new SignedRequestSupport(signatureVerifier, nonceRepository, metrics);
    }

    /**
     * 任何人都可以为尚未初始化的 context 设置首个 authority。
     */
    public void initAuthority(String context, String authority) {
        String ctx = requireNonZeroBytes32(context, "context");
        String auth = requireNonZeroAddress(authority, "authority");
        executor.execute("initAuthority", () -> {
            long now = clock.now();
            if (workspaceRepository.findAuthority(ctx).isPresent()
                    || !workspaceRepository.insertAuthorityIfAbsent(ctx, auth, now)) {
                throw new PreconditionFailedException("authority already set", "context 已设置 authority: " + ctx);
            }
            recordAuthority(ctx, auth, now);
            metrics.stateCommitted("initAuthority");
            log.info("workspace authority initialized context={} authority={}", ctx, auth);
        });
    }

    /**
     * 凭当前 authority 的签名轮换 authority。旧 authority 保留成员身份。
     */
    public void setAuthorityWithSig(String context, String newAuthority, long deadline, String signature) {
        String ctx = requireNonZeroBytes32(context, "context");
        String next = requireNonZeroAddress(newAuthority, "authority");
        executor.execute("setAuthorityWithSig", () -> {
            long now = clock.now();
            signed.requireNotExpired("setAuthorityWithSig", deadline, now);
            String current = requireAuthority(ctx);
            long nonce = signed.currentNonce(NONCE_REGISTRY, current);
            SetAuthorityPayload payload = new SetAuthorityPayload(ctx, next, nonce, deadline);
            signed.requireSigner("setAuthorityWithSig", config.getWorkspaceDomain(), payload, signature, current);

            signed.advanceNonce("setAuthorityWithSig", NONCE_REGISTRY, current, nonce);
            if (!workspaceRepository.compareAndSetAuthority(ctx, current, next, now)) {
                metrics.fencedWriteRejected("setAuthorityWithSig");
                throw new PreconditionFailedException("concurrent update", "authority 已被并发修改: " + ctx);
            }
            recordAuthority(ctx, next, now);
            metrics.stateCommitted("setAuthorityWithSig");
            log.info("workspace authority rotated context={} from={} to={}", ctx, current, next);
        });
    }

    /**
     * 凭 authority 的签名增删成员。移除 authority 在校验签名之前就被拒绝，nonce 不受影响。
     */
    public void setMemberWithSig(String context, String member, boolean isMember, long deadline, String signature) {
        String ctx = requireNonZeroBytes32(context, "context");
        String m = requireNonZeroAddress(member, "member");
        executor.execute("setMemberWithSig", () -> {
            long now = clock.now();
            signed.requireNotExpired("setMemberWithSig", deadline, now);
            String current = requireAuthority(ctx);
            if (!isMember && current.equals(m)) {
                throw new PreconditionFailedException("cannot remove authority", "不能移除 authority 的成员身份: " + m);
            }
            long nonce = signed.currentNonce(NONCE_REGISTRY, current);
            SetMemberPayload payload = new SetMemberPayload(ctx, m, isMember, nonce, deadline);
            signed.requireSigner("setMemberWithSig", config.getWorkspaceDomain(), payload, signature, current);

            signed.advanceNonce("setMemberWithSig", NONCE_REGISTRY, current, nonce);
            applyMember(ctx, m, isMember, now);
            metrics.stateCommitted("setMemberWithSig");
            log.info("workspace member set context={} member={} isMember={}", ctx, m, isMember);
        });
    }

    /**
     * 成员主动退出。
     */
    public void leave(String acting, String context) {
        String ctx = requireNonZeroBytes32(context, "context");
        String a = requireNonZeroAddress(acting, "acting");
        executor.execute("leave", () -> {
            Optional<String> authority = workspaceRepository.findAuthority(ctx);
            if (authority.isPresent() && authority.get().equals(a)) {
                throw new PreconditionFailedException("authority cannot leave", "authority 不能退出 workspace: " + a);
            }
            applyMember(ctx, a, false, clock.now());
            metrics.stateCommitted("leave");
            log.info("workspace member left context={} member={}", ctx, a);
        });
    }

    @Override
    public boolean isMember(String context, String identity) {
        String ctx = requireBytes32(context, "context");
        String id = requireAddress(identity, "identity");
        if (isZeroBytes32(ctx)) {
            return false;
        }
        return workspaceRepository.isMember(ctx, id);
    }

    public Optional<String> authorityOf(String context) {
        return workspaceRepository.findAuthority(requireBytes32(context, "context"));
    }

    public long nonceOf(String identity) {
        return signed.currentNonce(NONCE_REGISTRY, requireAddress(identity, "identity"));
    }

    private String requireAuthority(String context) {
        return workspaceRepository.findAuthority(context)
                .orElseThrow(() -> new PreconditionFailedException("authority not set", "context 尚未设置 authority: " + context));
    }

    private void recordAuthority(String context, String authority, long now) {
        eventRecorder.record(LedgerEventType.AUTHORITY_SET, now, fields(
                "contextId", context,
                "authority", authority));
        applyMember(context, authority, true, now);
    }

    private void applyMember(String context, String member, boolean isMember, long now) {
        workspaceRepository.setMember(context, member, isMember, now);
        eventRecorder.record(LedgerEventType.MEMBER_SET, now, fields(
                "contextId", context,
                "member", member,
                "isMember", isMember));
    }
}
