package com.work.provenance.core.repository.impl;

import com.work.provenance.core.model.Grant;
import com.work.provenance.core.repository.GrantRepository;
import com.work.provenance.core.repository.entity.GrantEntity;
import com.work.provenance.core.repository.mapper.GrantMapper;

import java.math.BigDecimal;
import java.util.Optional;

import static com.work.provenance.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 GrantRepository 实现。
 *
 * 注意：所有写方法都必须在账本步骤的事务中调用，事务边界由执行器统一管理。
 */
public class PostgresGrantRepository implements GrantRepository {

    private final GrantMapper grantMapper;

    public PostgresGrantRepository(GrantMapper grantMapper) {
        this.grantMapper = grantMapper;
    }

    @Override
    public Optional<Grant> find(String principal, String relayer, String context) {
        GrantEntity entity = grantMapper.selectByKey(principal, relayer, context);
        if (entity == null) {
            return Optional.empty();
        }
        return Optional.of(new Grant(entity.getPrincipal(), entity.getRelayer(), entity.getContextId(),
                entity.getScopeMask().toBigIntegerExact(), entity.getExpiry()));
    }

    @Override
    public void save(Grant grant) {
        requireNonNull(grant, "grant");
        GrantEntity entity = new GrantEntity();
        entity.setPrincipal(grant.getPrincipal());
        entity.setRelayer(grant.getRelayer());
        entity.setContextId(grant.getContext());
        entity.setScopeMask(new BigDecimal(grant.getScopeMask()));
        entity.setExpiry(grant.getExpiry());
        entity.setUpdatedAt(System.currentTimeMillis() / 1000L);
        grantMapper.upsert(entity);
    }
}
