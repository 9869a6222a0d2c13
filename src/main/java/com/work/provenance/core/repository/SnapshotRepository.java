package com.work.provenance.core.repository;

import com.work.provenance.core.model.Snapshot;

import java.util.Optional;

/**
 * 快照表，按 repoRef 分组，组内 index 从 0 连续递增。
 */
public interface SnapshotRepository {

    boolean existsByRoot(String repoRef, String merkleRoot);

    long countByRepo(String repoRef);

    Optional<Snapshot> findByIndex(String repoRef, long index);

    Optional<Snapshot> findByRoot(String repoRef, String merkleRoot);

    /**
     * 追加一条快照，index 由调用方按 {@link #countByRepo(String)} 分配。
     *
     * @throws com.work.provenance.core.exception.PreconditionFailedException root 重复，或索引位置已被并发占用
     */
    void insert(Snapshot snapshot);
}
