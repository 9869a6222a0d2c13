package com.work.provenance.core.repository;

import com.work.provenance.core.model.Grant;

import java.util.Optional;

/**
 * 授权表，键为 (principal, relayer, context)。
 * 写方法必须在 {@link com.work.provenance.core.execution.LedgerExecutor} 的账本步骤内调用。
 */
public interface GrantRepository {

    Optional<Grant> find(String principal, String relayer, String context);

    /**
     * upsert：同一个键只保留一条记录，重复注册直接覆盖。
     */
    void save(Grant grant);
}
