package com.work.provenance.core.exception;

/**
 * 状态前置条件不满足，没有任何部分写入。
 */
public class PreconditionFailedException extends ProvenanceException {

    public PreconditionFailedException(String reason, String message) {
        super(ErrorCode.PRECONDITION_FAILED, reason, message);
    }

    public PreconditionFailedException(String reason, String message, Throwable cause) {
        super(ErrorCode.PRECONDITION_FAILED, reason, message, cause);
    }
}
