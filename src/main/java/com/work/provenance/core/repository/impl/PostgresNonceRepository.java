package com.work.provenance.core.repository.impl;

import com.work.provenance.core.repository.NonceRepository;
import com.work.provenance.core.repository.mapper.NonceCounterMapper;

/**
 * 基于 PostgreSQL 的 nonce 计数器：行不存在视为 0，推进前按需插入初始行（ON CONFLICT DO NOTHING），
 * 再以 WHERE nonce = expected 做 CAS 更新。
 */
public class PostgresNonceRepository implements NonceRepository {

    private final NonceCounterMapper nonceMapper;

    public PostgresNonceRepository(NonceCounterMapper nonceMapper) {
        this.nonceMapper = nonceMapper;
    }

    @Override
    public long currentNonce(String registry, String principal) {
        Long nonce = nonceMapper.selectNonce(registry, principal);
        return nonce == null ? 0L : nonce;
    }

    @Override
    public int compareAndAdvance(String registry, String principal, long expected) {
        long now = System.currentTimeMillis() / 1000L;
        if (expected == 0L) {
            nonceMapper.insertIfNotExists(registry, principal, now);
        }
        return nonceMapper.casAdvance(registry, principal, expected, now);
    }
}
