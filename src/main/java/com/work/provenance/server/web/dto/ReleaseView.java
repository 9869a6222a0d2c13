package com.work.provenance.server.web.dto;

public class ReleaseView {

    private String id;

    private String projectId;

    private String context;

    private String manifestRef;

    private String name;

    private String author;

    private String governanceAuthority;

    private Long createdAt;

    private String status;

    private Boolean revoked;

    private String supersededBy;

    private Long statusTimestamp;

    private String statusAuthor;

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

    public String getContext() {
        return context;
    }

    public void setContext(String context) {
        this.context = context;
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

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
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
