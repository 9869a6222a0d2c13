package com.work.provenance.core.exception;

/**
 * 签名恢复失败或签名者不匹配；nonce 不会前进。
 */
public class SignatureInvalidException extends ProvenanceException {

    public SignatureInvalidException(String reason, String message) {
        super(ErrorCode.SIGNATURE_INVALID, reason, message);
    }

    public SignatureInvalidException(String reason, String message, Throwable cause) {
        super(ErrorCode.SIGNATURE_INVALID, reason, message, cause);
    }
}
