package com.work.provenance.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

/**
 * release 表实体类。project_index 为该 release 在所属项目内的创建序号。
 */
@TableName("ledger_release")
public class ReleaseEntity {

    @TableId(value = "id", type = IdType.INPUT)
    private String id;

    private String projectId;

    private Long projectIndex;

    private String contextId;

    private String manifestRef;

    private String name;

    private String author;

    private String governanceAuthority;

    private Long createdAt;

    private Integer status;

    private Boolean revoked;

    private String supersededBy;

    private Long statusTimestamp;

    private String statusAuthor;

    public ReleaseEntity() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public Long getProjectIndex() {
        return projectIndex;
    }

    public void setProjectIndex(Long projectIndex) {
        this.projectIndex = projectIndex;
    }

    public String getContextId() {
        return contextId;
    }

    public void setContextId(String contextId) {
        this.contextId = contextId;
    }

    public String getManifestRef() {
        return manifestRef;
    }

    public void setManifestRef(String manifestRef) {
        this.manifestRef = manifestRef;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getGovernanceAuthority() {
        return governanceAuthority;
    }

    public void setGovernanceAuthority(String governanceAuthority) {
        this.governanceAuthority = governanceAuthority;
    }

    public Long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Long createdAt) {
        this.createdAt = createdAt;
    }

    public Integer getStatus() {
        return status;
    }

    public void setStatus(Integer status) {
        this.status = status;
    }

    public Boolean getRevoked() {
        return revoked;
    }

    public void setRevoked(Boolean revoked) {
        this.revoked = revoked;
    }

    public String getSupersededBy() {
        return supersededBy;
    }

    public void setSupersededBy(String supersededBy) {
        this.supersededBy = supersededBy;
    }

    public Long getStatusTimestamp() {
        return statusTimestamp;
    }

    public void setStatusTimestamp(Long statusTimestamp) {
        this.statusTimestamp = statusTimestamp;
    }

    public String getStatusAuthor() {
        return statusAuthor;
    }

    public void setStatusAuthor(String statusAuthor) {
        this.statusAuthor = statusAuthor;
    }
}
