package com.work.provenance.core.repository;

import com.work.provenance.core.model.Release;

import java.util.List;
import java.util.Optional;

/**
 * release 表及其按项目的创建顺序索引，另含每个 context 的 DAO executor 配置。
 */
public interface ReleaseRepository {

    Optional<Release> findById(String id);

    /**
     * 插入新 release 并追加到所属项目索引的末尾。
     *
     * @throws com.work.provenance.core.exception.PreconditionFailedException id 已存在，或项目索引位置已被并发占用
     */
    void insert(Release release);

    /**
     * 围栏更新：仅当存储中的 status、revoked、supersededBy 仍等于 expected 时，
     * 写入 updated 的可变字段（status、revoked、supersededBy、statusTimestamp、statusAuthor）。
     *
     * @return 是否写入成功；false 表示记录已被并发修改
     */
    boolean compareAndUpdate(Release expected, Release updated);

    long countByProject(String projectId);

    Optional<Release> findByProjectIndex(String projectId, long index);

    List<Release> listByProject(String projectId, long offset, int limit);

    Optional<String> findDaoExecutor(String context);

    /**
     * executor 为 null 表示清除配置。
     */
    void saveDaoExecutor(String context, String executor, long updatedAt);
}
