package com.work.provenance.core.repository.impl;

import com.work.provenance.core.exception.PreconditionFailedException;
import com.work.provenance.core.model.Snapshot;
import com.work.provenance.core.repository.SnapshotRepository;
import com.work.provenance.core.repository.entity.SnapshotEntity;
import com.work.provenance.core.repository.mapper.SnapshotMapper;

import org.springframework.dao.DuplicateKeyException;

import java.util.Optional;

import static com.work.provenance.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL 的快照存储，(repo_ref, merkle_root) 唯一约束兜底重复 root。
 */
public class PostgresSnapshotRepository implements SnapshotRepository {

    static final String ROOT_UNIQUE_KEY = "ledger_snapshot_repo_ref_merkle_root_key";

    private final SnapshotMapper snapshotMapper;

    public PostgresSnapshotRepository(SnapshotMapper snapshotMapper) {
        this.snapshotMapper = snapshotMapper;
    }

    @Override
    public boolean existsByRoot(String repoRef, String merkleRoot) {
        return snapshotMapper.selectByRoot(repoRef, merkleRoot) != null;
    }

    @Override
    public long countByRepo(String repoRef) {
        return snapshotMapper.countByRepo(repoRef);
    }

    @Override
    public Optional<Snapshot> findByIndex(String repoRef, long index) {
        return Optional.ofNullable(snapshotMapper.selectByIndex(repoRef, index)).map(PostgresSnapshotRepository::toSnapshot);
    }

    @Override
    public Optional<Snapshot> findByRoot(String repoRef, String merkleRoot) {
        return Optional.ofNullable(snapshotMapper.selectByRoot(repoRef, merkleRoot)).map(PostgresSnapshotRepository::toSnapshot);
    }

    @Override
    public void insert(Snapshot snapshot) {
        requireNonNull(snapshot, "snapshot");
        SnapshotEntity entity = new SnapshotEntity();
        entity.setRepoRef(snapshot.getRepoRef());
        entity.setSnapshotIndex(snapshot.getIndex());
        entity.setContextId(snapshot.getContext());
        entity.setAuthor(snapshot.getAuthor());
        entity.setCommitHash(snapshot.getCommitHash());
        entity.setMerkleRoot(snapshot.getMerkleRoot());
        entity.setManifestRef(snapshot.getManifestRef());
        entity.setCreatedAt(snapshot.getCreatedAt());
        try {
            snapshotMapper.insertSnapshot(entity);
        } catch (DuplicateKeyException e) {
            if (String.valueOf(e.getMessage()).contains(ROOT_UNIQUE_KEY)) {
                throw new PreconditionFailedException("duplicate root",
                        "该 repo 已存在相同 merkleRoot 的快照: " + snapshot.getMerkleRoot(), e);
            }
            throw new PreconditionFailedException("concurrent update",
                    "快照索引位置已被并发占用: repo=" + snapshot.getRepoRef() + ", index=" + snapshot.getIndex(), e);
        }
    }

    private static Snapshot toSnapshot(SnapshotEntity e) {
        return new Snapshot(e.getRepoRef(), e.getSnapshotIndex(), e.getContextId(), e.getAuthor(),
                e.getCommitHash(), e.getMerkleRoot(), e.getManifestRef(), e.getCreatedAt());
    }
}
