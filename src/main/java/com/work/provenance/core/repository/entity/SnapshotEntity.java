package com.work.provenance.core.repository.entity;

import com.baomidou.mybatisplus.annotation.TableName;

/**
 * 快照表实体类，主键为 (repo_ref, snapshot_index)，(repo_ref, merkle_root) 唯一。
 */
@TableName("ledger_snapshot")
public class SnapshotEntity {

    private String repoRef;

    private Long snapshotIndex;

    private String contextId;

    private String author;

    private String commitHash;

    private String merkleRoot;

    private String manifestRef;

    private Long createdAt;

    public SnapshotEntity() {
    }

    public String getRepoRef() {
        return repoRef;
    }

    public void setRepoRef(String repoRef) {
        this.repoRef = repoRef;
    }

    public Long getSnapshotIndex() {
        return snapshotIndex;
    }

    public void setSnapshotIndex(Long snapshotIndex) {
        this.snapshotIndex = snapshotIndex;
    }

    public String getContextId() {
        return contextId;
    }

    public void setContextId(String contextId) {
        this.contextId = contextId;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getCommitHash() {
        return commitHash;
    }

    public void setCommitHash(String commitHash) {
        this.commitHash = commitHash;
    }

    public String getMerkleRoot() {
        return merkleRoot;
    }

    public void setMerkleRoot(String merkleRoot) {
        this.merkleRoot = merkleRoot;
    }

    public String getManifestRef() {
        return manifestRef;
    }

    public void setManifestRef(String manifestRef) {
        this.manifestRef = manifestRef;
    }

    public Long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Long createdAt) {
        this.createdAt = createdAt;
    }
}
