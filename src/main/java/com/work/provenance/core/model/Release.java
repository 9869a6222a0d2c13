package com.work.provenance.core.model;

import java.util.Objects;

/**
 * release 记录。
 *
 * 注意：
 * 1. id、projectId、context、manifestRef、name、author、governanceAuthority、createdAt 创建后不可变
 * 2. status 只能从 PENDING 迁移一次；revoked 只能从 false 变为 true；supersededBy 只能在 revoked 之后设置一次
 * 3. 此对象在串行化的账本步骤内修改，线程安全性由执行器保证
 */
public class Release {

    private final String id;
    private final String projectId;
    private final String context;
    private final String manifestRef;
    private final String name;
    private final String author;
    private final String governanceAuthority;
    private final long createdAt;
    private ReleaseStatus status;
    private boolean revoked;
    private String supersededBy;
    private long statusTimestamp;
    private String statusAuthor;

    public Release(String id,
                   String projectId,
                   String context,
                   String manifestRef,
                   String name,
                   String author,
                   String governanceAuthority,
                   long createdAt) {
        this(id, projectId, context, manifestRef, name, author, governanceAuthority, createdAt,
                ReleaseStatus.PENDING, false, null, 0L, null);
    }

    public Release(String id,
                   String projectId,
                   String context,
                   String manifestRef,
                   String name,
                   String author,
                   String governanceAuthority,
                   long createdAt,
                   ReleaseStatus status,
                   boolean revoked,
                   String supersededBy,
                   long statusTimestamp,
                   String statusAuthor) {
        if (id == null || projectId == null || context == null) {
            throw new IllegalArgumentException("id/projectId/context 不能为null");
        }
        if (author == null || governanceAuthority == null) {
            throw new IllegalArgumentException("author/governanceAuthority 不能为null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status 不能为null");
        }
        if (supersededBy != null && !revoked) {
            throw new IllegalArgumentException("未撤销的 release 不能被替代: " + id);
        }
        this.id = id;
        this.projectId = projectId;
        this.context = context;
        this.manifestRef = manifestRef;
        this.name = name;
        this.author = author;
        this.governanceAuthority = governanceAuthority;
        this.createdAt = createdAt;
        this.status = status;
        this.revoked = revoked;
        this.supersededBy = supersededBy;
        this.statusTimestamp = statusTimestamp;
        this.statusAuthor = statusAuthor;
    }

    /**
     * 拷贝一份，仓储返回副本，避免调用方绕过服务直接改内存状态。
     */
    public Release copy() {
        return new Release(id, projectId, context, manifestRef, name, author, governanceAuthority, createdAt,
                status, revoked, supersededBy, statusTimestamp, statusAuthor);
    }

    public String getId() {
        return id;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getContext() {
        return context;
    }

    public String getManifestRef() {
        return manifestRef;
    }

    public String getName() {
        return name;
    }

    public String getAuthor() {
        return author;
    }

    public String getGovernanceAuthority() {
        return governanceAuthority;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public ReleaseStatus getStatus() {
        return status;
    }

    public boolean isRevoked() {
        return revoked;
    }

    public String getSupersededBy() {
        return supersededBy;
    }

    public long getStatusTimestamp() {
        return statusTimestamp;
    }

    public String getStatusAuthor() {
        return statusAuthor;
    }

    public void applyGovernance(ReleaseStatus newStatus, String actor, long timestamp) {
        if (newStatus == null || !newStatus.isTerminal()) {
            throw new IllegalArgumentException("目标状态必须是 ACCEPTED 或 REJECTED");
        }
        if (status.isTerminal()) {
            throw new IllegalStateException("治理状态已确定，不能再次修改: " + id);
        }
        this.status = newStatus;
        this.statusAuthor = actor;
        this.statusTimestamp = timestamp;
    }

    public void markRevoked() {
        this.revoked = true;
    }

    public void markSupersededBy(String newId) {
        if (!revoked) {
            throw new IllegalStateException("release 尚未撤销: " + id);
        }
        if (supersededBy != null) {
            throw new IllegalStateException("release 已被替代: " + id);
        }
        this.supersededBy = newId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Release) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Release{" +
                "id='" + id + '\'' +
                ", projectId='" + projectId + '\'' +
                ", name='" + name + '\'' +
                ", status=" + status +
                ", revoked=" + revoked +
                ", supersededBy='" + supersededBy + '\'' +
                '}';
    }
}
