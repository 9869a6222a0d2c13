package com.work.provenance.core.support;

import com.work.provenance.core.model.Grant;
import com.work.provenance.core.repository.GrantRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 纯内存实现，用于测试与 ledger.store=memory 的单节点部署。
 * 注意：该实现不具备跨进程一致性。
 */
public class InMemoryGrantRepository implements GrantRepository {

    private final Map<String, Grant> grantTable = new ConcurrentHashMap<>();

    private static String key(String principal, String relayer, String context) {
        return principal + "|" + relayer + "|" + context;
    }

    @Override
    public Optional<Grant> find(String principal, String relayer, String context) {
        return Optional.ofNullable(grantTable.get(key(principal, relayer, context)));
    }

    @Override
    public void save(Grant grant) {
        grantTable.put(key(grant.getPrincipal(), grant.getRelayer(), grant.getContext()), grant);
    }
}
