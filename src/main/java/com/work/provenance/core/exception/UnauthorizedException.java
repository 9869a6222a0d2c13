package com.work.provenance.core.exception;

/**
 * 调用方没有代表 principal 执行该操作的资格。
 */
public class UnauthorizedException extends ProvenanceException {

    public UnauthorizedException(String reason, String message) {
        super(ErrorCode.UNAUTHORIZED, reason, message);
    }

    public UnauthorizedException(String reason, String message, Throwable cause) {
        super(ErrorCode.UNAUTHORIZED, reason, message, cause);
    }
}
