package com.work.provenance.core.support;

import com.work.provenance.core.model.Snapshot;
import com.work.provenance.core.repository.SnapshotRepository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 纯内存快照表。写入由账本执行器串行化，这里只保证读可见性。
 */
public class InMemorySnapshotRepository implements SnapshotRepository {

    private final Map<String, List<Snapshot>> snapshotTable = new ConcurrentHashMap<>();
    private final Map<String, Snapshot> rootIndex = new ConcurrentHashMap<>();

    @Override
    public boolean existsByRoot(String repoRef, String merkleRoot) {
        return rootIndex.containsKey(repoRef + "|" + merkleRoot);
    }

    @Override
    public long countByRepo(String repoRef) {
        List<Snapshot> snapshots = snapshotTable.get(repoRef);
        return snapshots == null ? 0L : snapshots.size();
    }

    @Override
    public Optional<Snapshot> findByIndex(String repoRef, long index) {
        List<Snapshot> snapshots = snapshotTable.get(repoRef);
        if (snapshots == null || index < 0 || index >= snapshots.size()) {
            return Optional.empty();
        }
        return Optional.of(snapshots.get((int) index));
    }

    @Override
    public Optional<Snapshot> findByRoot(String repoRef, String merkleRoot) {
        return Optional.ofNullable(rootIndex.get(repoRef + "|" + merkleRoot));
    }

    @Override
    public void insert(Snapshot snapshot) {
        String rootKey = snapshot.getRepoRef() + "|" + snapshot.getMerkleRoot();
        if (rootIndex.putIfAbsent(rootKey, snapshot) != null) {
            throw new IllegalStateException("快照 root 已存在: " + rootKey);
        }
        snapshotTable.computeIfAbsent(snapshot.getRepoRef(), key -> new CopyOnWriteArrayList<>()).add(snapshot);
    }
}
