package com.work.provenance.core.exception;

/**
 * 组件内部的统一异常类型，便于业务侧捕获或转换为 HTTP 错误码。
 * <p>{@link #getReason()} 是简短且稳定的机器可读原因（如 {@code bad signer}），
 * message 面向人工排查。</p>
 */
public class ProvenanceException extends RuntimeException {

    private final ErrorCode code;
    private final String reason;

    public ProvenanceException(ErrorCode code, String reason, String message) {
        super(message);
        this.code = code;
        this.reason = reason;
    }

    public ProvenanceException(ErrorCode code, String reason, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.reason = reason;
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }
}
