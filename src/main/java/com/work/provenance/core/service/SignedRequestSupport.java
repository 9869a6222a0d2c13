package com.work.provenance.core.service;

import com.work.provenance.core.crypto.SignatureVerifier;
import com.work.provenance.core.crypto.TypedDataDomain;
import com.work.provenance.core.crypto.TypedPayload;
import com.work.provenance.core.exception.SignatureExpiredException;
import com.work.provenance.core.exception.SignatureInvalidException;
import com.work.provenance.core.repository.NonceRepository;
import com.work.provenance.core.support.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 签名请求的公共校验步骤：deadline、签名者恢复、nonce CAS 推进。
 * 调用顺序固定为 deadline -> 签名 -> nonce，前两步失败时 nonce 保持不变。
 */
final class SignedRequestSupport {

    private static final Logger log = LoggerFactory.getLogger(SignedRequestSupport.class);

    private final SignatureVerifier signatureVerifier;
    private final NonceRepository nonceRepository;
    private final LedgerMetrics metrics;

    SignedRequestSupport(SignatureVerifier signatureVerifier,
                         NonceRepository nonceRepository,
                         LedgerMetrics metrics) {
        this.signatureVerifier = signatureVerifier;
        this.nonceRepository = nonceRepository;
        this.metrics = metrics;
    }

    void requireNotExpired(String op, long deadline, long now) {
        if (now > deadline) {
            metrics.signatureRejected(op, "sig expired");
            throw new SignatureExpiredException("sig expired",
                    op + " 签名已过期: deadline=" + deadline + ", now=" + now);
        }
    }

    long currentNonce(String registry, String principal) {
        return nonceRepository.currentNonce(registry, principal);
    }

    void requireSigner(String op, TypedDataDomain domain, TypedPayload payload,
                       String signature, String expectedSigner) {
        String recovered;
        try {
            recovered = signatureVerifier.recoverSigner(domain, payload, signature);
        } catch (SignatureInvalidException e) {
            metrics.signatureRejected(op, e.getReason());
            log.warn("signature rejected op={} expected={} err={}", op, expectedSigner, e.getMessage());
            throw e;
        }
        if (recovered == null || !recovered.equalsIgnoreCase(expectedSigner)) {
            metrics.signatureRejected(op, "bad signer");
            log.warn("signature rejected op={} expected={} recovered={}", op, expectedSigner, recovered);
            throw new SignatureInvalidException("bad signer",
                    op + " 签名者不匹配: expected=" + expectedSigner + ", recovered=" + recovered);
        }
    }

    /**
     * CAS 推进 nonce。更新 0 行说明签名所用 nonce 已被消费，按签名无效处理。
     */
    void advanceNonce(String op, String registry, String principal, long expected) {
        int updated = nonceRepository.compareAndAdvance(registry, principal, expected);
        if (updated != 1) {
            metrics.signatureRejected(op, "bad signer");
            throw new SignatureInvalidException("bad signer",
                    op + " nonce 已被消费: registry=" + registry + ", principal=" + principal + ", nonce=" + expected);
        }
    }
}
