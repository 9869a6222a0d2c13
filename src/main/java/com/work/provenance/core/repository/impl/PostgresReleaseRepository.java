package com.work.provenance.core.repository.impl;

import com.work.provenance.core.exception.PreconditionFailedException;
import com.work.provenance.core.model.Release;
import com.work.provenance.core.model.ReleaseStatus;
import com.work.provenance.core.repository.ReleaseRepository;
import com.work.provenance.core.repository.entity.DaoExecutorEntity;
import com.work.provenance.core.repository.entity.ReleaseEntity;
import com.work.provenance.core.repository.mapper.ReleaseMapper;
import org.springframework.dao.DuplicateKeyException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.work.provenance.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL 的 release 存储。
 *
 * 注意：
 * 1. project_index 在插入时按 COUNT(*) 分配，多节点并发时由 (project_id, project_index) 唯一约束兜底
 * 2. 状态迁移一律走带围栏条件的 UPDATE，不可变字段从不回写
 */
public class PostgresReleaseRepository implements ReleaseRepository {

    static final String PRIMARY_KEY = "ledger_release_pkey";

    private final ReleaseMapper releaseMapper;

    public PostgresReleaseRepository(ReleaseMapper releaseMapper) {
        this.releaseMapper = releaseMapper;
    }

    @Override
    public Optional<Release> findById(String id) {
        return Optional.ofNullable(releaseMapper.selectById(id)).map(PostgresReleaseRepository::toRelease);
    }

    @Override
    public void insert(Release release) {
        requireNonNull(release, "release");
        ReleaseEntity entity = toEntity(release);
        entity.setProjectIndex(releaseMapper.countByProject(release.getProjectId()));
        try {
            releaseMapper.insert(entity);
        } catch (DuplicateKeyException e) {
            if (String.valueOf(e.getMessage()).contains(PRIMARY_KEY)) {
                throw new PreconditionFailedException("release exists", "release id 已存在: " + release.getId(), e);
            }
            throw new PreconditionFailedException("concurrent update",
                    "项目索引位置已被并发占用: project=" + release.getProjectId()
                            + ", index=" + entity.getProjectIndex(), e);
        }
    }

    @Override
    public boolean compareAndUpdate(Release expected, Release updated) {
        requireNonNull(expected, "expected");
        requireNonNull(updated, "updated");
        int rows = releaseMapper.updateMutableFenced(toEntity(updated),
                expected.getStatus().getCode(), expected.isRevoked(), expected.getSupersededBy());
        return rows == 1;
    }

    @Override
    public long countByProject(String projectId) {
        return releaseMapper.countByProject(projectId);
    }

    @Override
    public Optional<Release> findByProjectIndex(String projectId, long index) {
        return Optional.ofNullable(releaseMapper.selectByProjectIndex(projectId, index))
                .map(PostgresReleaseRepository::toRelease);
    }

    @Override
    public List<Release> listByProject(String projectId, long offset, int limit) {
        List<ReleaseEntity> entities = releaseMapper.listByProject(projectId, offset, limit);
        List<Release> result = new ArrayList<>(entities.size());
        for (ReleaseEntity entity : entities) {
            result.add(toRelease(entity));
        }
        return result;
    }

    @Override
    public Optional<String> findDaoExecutor(String context) {
        DaoExecutorEntity entity = releaseMapper.selectDaoExecutor(context);
        return entity == null ? Optional.empty() : Optional.of(entity.getExecutor());
    }

    @Override
    public void saveDaoExecutor(String context, String executor, long updatedAt) {
        if (executor == null) {
            releaseMapper.deleteDaoExecutor(context);
        } else {
            releaseMapper.upsertDaoExecutor(context, executor, updatedAt);
        }
    }

    private static ReleaseEntity toEntity(Release r) {
        ReleaseEntity e = new ReleaseEntity();
        e.setId(r.getId());
        e.setProjectId(r.getProjectId());
        e.setContextId(r.getContext());
        e.setManifestRef(r.getManifestRef());
        e.setName(r.getName());
        e.setAuthor(r.getAuthor());
        e.setGovernanceAuthority(r.getGovernanceAuthority());
        e.setCreatedAt(r.getCreatedAt());
        e.setStatus(r.getStatus().getCode());
        e.setRevoked(r.isRevoked());
        e.setSupersededBy(r.getSupersededBy());
        e.setStatusTimestamp(r.getStatusTimestamp());
        e.setStatusAuthor(r.getStatusAuthor());
        return e;
    }

    private static Release toRelease(ReleaseEntity e) {
        return new Release(e.getId(), e.getProjectId(), e.getContextId(), e.getManifestRef(), e.getName(),
                e.getAuthor(), e.getGovernanceAuthority(), e.getCreatedAt(),
                ReleaseStatus.fromCode(e.getStatus()),
                Boolean.TRUE.equals(e.getRevoked()),
                e.getSupersededBy(),
                e.getStatusTimestamp() == null ? 0L : e.getStatusTimestamp(),
                e.getStatusAuthor());
    }
}
