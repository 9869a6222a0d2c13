package com.work.provenance.core.exception;

/**
 * 对外稳定的错误标签，relayer 侧据此决定重新签名、重新提交还是放弃。
 */
public enum ErrorCode {
    /**
     * 零地址/零 context、格式错误的地址或签名、空 manifest 等，在读取任何状态前拒绝。
     */
    INVALID_INPUT,
    /**
     * 授权的 expiry 不晚于当前时间。
     */
    BAD_EXPIRY,
    /**
     * 恢复出的签名者与期望的 principal 不一致（包括 nonce 已前进后的重放）。
     */
    SIGNATURE_INVALID,
    /**
     * 当前时间已超过签名的 deadline，需要重新签名。
     */
    SIGNATURE_EXPIRED,
    /**
     * 状态不满足迁移条件：重复 id、状态不是 PENDING、快照不存在、非成员等。
     */
    PRECONDITION_FAILED,
    /**
     * 调用方既不是 principal 本人，也没有覆盖该能力的有效授权。
     */
    UNAUTHORIZED,
    /**
     * 查询的记录不存在。
     */
    NOT_FOUND
}
