package com.work.provenance.core.support;

import com.work.provenance.core.repository.NonceRepository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 纯内存 nonce 计数器，CAS 语义由 {@link AtomicLong#compareAndSet(long, long)} 提供。
 */
public class InMemoryNonceRepository implements NonceRepository {

    private final Map<String, AtomicLong> nonceTable = new ConcurrentHashMap<>();

    private AtomicLong counter(String registry, String principal) {
        return nonceTable.computeIfAbsent(registry + "|" + principal, key -> new AtomicLong(0L));
    }

    @Override
    public long currentNonce(String registry, String principal) {
        AtomicLong c = nonceTable.get(registry + "|" + principal);
        return c == null ? 0L : c.get();
    }

    @Override
    public int compareAndAdvance(String registry, String principal, long expected) {
        return counter(registry, principal).compareAndSet(expected, expected + 1) ? 1 : 0;
    }
}
