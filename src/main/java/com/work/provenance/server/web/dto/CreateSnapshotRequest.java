package com.work.provenance.server.web.dto;

import javax.validation.constraints.NotBlank;

public class CreateSnapshotRequest {

    @NotBlank(message = "repo 不能为空")
    private String repo;

    @NotBlank(message = "context 不能为空")
    private String context;

    @NotBlank(message = "commitHash 不能为空")
    private String commitHash;

    @NotBlank(message = "merkleRoot 不能为空")
    private String merkleRoot;

    @NotBlank(message = "manifestRef 不能为空")
    private String manifestRef;

    @NotBlank(message = "author 不能为空")
    private String author;

    public String getRepo() {
        return repo;
    }

    public void setRepo(String repo) {
        this.repo = repo;
    }

    public String getContext() {
        return context;
    }

    public void setContext(String context) {
        this.context = context;
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

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }
}
