package com.work.provenance.core.repository;

/**
 * 签名重放保护计数器，每个签名域（registry）下每个 principal 一个计数器，从 0 开始。
 */
public interface NonceRepository {

    long currentNonce(String registry, String principal);

    /**
     * CAS 推进：仅当当前值等于 expected 时写入 expected + 1。
     *
     * @return 更新行数，0 表示并发冲突（计数器已被其他步骤推进）
     */
    int compareAndAdvance(String registry, String principal, long expected);
}
