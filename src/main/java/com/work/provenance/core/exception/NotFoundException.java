package com.work.provenance.core.exception;

/**
 * 记录不存在。
 */
public class NotFoundException extends ProvenanceException {

    public NotFoundException(String reason, String message) {
        super(ErrorCode.NOT_FOUND, reason, message);
    }

    public NotFoundException(String reason, String message, Throwable cause) {
        super(ErrorCode.NOT_FOUND, reason, message, cause);
    }
}
