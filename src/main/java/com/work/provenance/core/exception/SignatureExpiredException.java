package com.work.provenance.core.exception;

/**
 * 签名已过 deadline；nonce 不会前进，调用方需延长 deadline 后重新签名。
 */
public class SignatureExpiredException extends ProvenanceException {

    public SignatureExpiredException(String reason, String message) {
        super(ErrorCode.SIGNATURE_EXPIRED, reason, message);
    }

    public SignatureExpiredException(String reason, String message, Throwable cause) {
        super(ErrorCode.SIGNATURE_EXPIRED, reason, message, cause);
    }
}
