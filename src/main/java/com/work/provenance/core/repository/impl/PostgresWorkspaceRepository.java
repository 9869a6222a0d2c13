package com.work.provenance.core.repository.impl;

import com.work.provenance.core.repository.WorkspaceRepository;
import com.work.provenance.core.repository.mapper.WorkspaceMapper;

import java.util.Optional;

/**
 * 基于 PostgreSQL 的 workspace 存储。成员移除以 active = false 记录，不删除行。
 * authority 只通过 ON CONFLICT DO NOTHING 首次写入，之后只做带围栏条件的替换。
 */
public class PostgresWorkspaceRepository implements WorkspaceRepository {

    private final WorkspaceMapper workspaceMapper;

    public PostgresWorkspaceRepository(WorkspaceMapper workspaceMapper) {
        this.workspaceMapper = workspaceMapper;
    }

    @Override
    public Optional<String> findAuthority(String context) {
        return Optional.ofNullable(workspaceMapper.selectAuthority(context));
    }

    @Override
    public boolean insertAuthorityIfAbsent(String context, String authority, long updatedAt) {
        return workspaceMapper.insertAuthorityIfAbsent(context, authority, updatedAt) == 1;
    }

    @Override
    public boolean compareAndSetAuthority(String context, String expected, String next, long updatedAt) {
        return workspaceMapper.updateAuthorityFenced(context, expected, next, updatedAt) == 1;
    }

    @Override
    public boolean isMember(String context, String member) {
        return Boolean.TRUE.equals(workspaceMapper.selectMemberActive(context, member));
    }

    @Override
    public void setMember(String context, String member, boolean isMember, long updatedAt) {
        workspaceMapper.upsertMember(context, member, isMember, updatedAt);
    }
}
