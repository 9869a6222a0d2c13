package com.work.provenance.core.exception;

/**
 * 入参非法，在读取任何状态之前拒绝。
 * <p>默认标签为 {@link ErrorCode#INVALID_INPUT}；授权过期时间非法时使用 {@link ErrorCode#BAD_EXPIRY}。</p>
 */
public class InvalidInputException extends ProvenanceException {

    public InvalidInputException(String reason, String message) {
        super(ErrorCode.INVALID_INPUT, reason, message);
    }

    public InvalidInputException(String reason, String message, Throwable cause) {
        super(ErrorCode.INVALID_INPUT, reason, message, cause);
    }

    public static InvalidInputException badExpiry(long expiry, long now) {
        return new InvalidInputException(ErrorCode.BAD_EXPIRY, "bad expiry",
                "expiry 必须晚于当前时间: expiry=" + expiry + ", now=" + now);
    }

    private InvalidInputException(ErrorCode code, String reason, String message) {
        super(code, reason, message);
    }
}
