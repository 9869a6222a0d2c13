package com.work.provenance.core.support;

import com.work.provenance.core.exception.PreconditionFailedException;
import com.work.provenance.core.model.Release;
import com.work.provenance.core.repository.ReleaseRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 纯内存 release 表。对外一律返回副本，状态修改必须走 {@link #compareAndUpdate(Release, Release)}。
 */
public class InMemoryReleaseRepository implements ReleaseRepository {

    private final Map<String, Release> releaseTable = new ConcurrentHashMap<>();
    private final Map<String, List<String>> projectIndex = new ConcurrentHashMap<>();
    private final Map<String, String> daoExecutorTable = new ConcurrentHashMap<>();

    @Override
    public Optional<Release> findById(String id) {
        Release r = releaseTable.get(id);
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    @Override
    public void insert(Release release) {
        if (releaseTable.putIfAbsent(release.getId(), release.copy()) != null) {
            throw new PreconditionFailedException("release exists", "release id 已存在: " + release.getId());
        }
        projectIndex.computeIfAbsent(release.getProjectId(), key -> new CopyOnWriteArrayList<>()).add(release.getId());
    }

    @Override
    public synchronized boolean compareAndUpdate(Release expected, Release updated) {
        Release current = releaseTable.get(expected.getId());
        if (current == null
                || current.getStatus() != expected.getStatus()
                || current.isRevoked() != expected.isRevoked()
                || !Objects.equals(current.getSupersededBy(), expected.getSupersededBy())) {
            return false;
        }
        releaseTable.put(updated.getId(), updated.copy());
        return true;
    }

    @Override
    public long countByProject(String projectId) {
        List<String> ids = projectIndex.get(projectId);
        return ids == null ? 0L : ids.size();
    }

    @Override
    public Optional<Release> findByProjectIndex(String projectId, long index) {
        List<String> ids = projectIndex.get(projectId);
        if (ids == null || index < 0 || index >= ids.size()) {
            return Optional.empty();
        }
        return findById(ids.get((int) index));
    }

    @Override
    public List<Release> listByProject(String projectId, long offset, int limit) {
        List<String> ids = projectIndex.get(projectId);
        if (ids == null || offset >= ids.size() || limit <= 0) {
            return Collections.emptyList();
        }
        int from = (int) Math.max(0L, offset);
        int to = (int) Math.min((long) ids.size(), from + (long) limit);
        List<Release> out = new ArrayList<>(to - from);
        for (String id : ids.subList(from, to)) {
            out.add(releaseTable.get(id).copy());
        }
        return out;
    }

    @Override
    public Optional<String> findDaoExecutor(String context) {
        return Optional.ofNullable(daoExecutorTable.get(context));
    }

    @Override
    public void saveDaoExecutor(String context, String executor, long updatedAt) {
        if (executor == null) {
            daoExecutorTable.remove(context);
        } else {
            daoExecutorTable.put(context, executor);
        }
    }
}
