package com.work.provenance.core.model;

/**
 * 一次源码快照的锚定记录，同一 repo 内按 index 递增，merkleRoot 唯一。
 */
public class Snapshot {

    private final String repoRef;
    private final long index;
    private final String context;
    private final String author;
    private final String commitHash;
    private final String merkleRoot;
    private final String manifestRef;
    private final long createdAt;

    public Snapshot(String repoRef,
                    long index,
                    String context,
                    String author,
                    String commitHash,
                    String merkleRoot,
                    String manifestRef,
                    long createdAt) {
        if (index < 0) {
            throw new IllegalArgumentException("index 不能为负数");
        }
        this.repoRef = repoRef;
        this.index = index;
        this.context = context;
        this.author = author;
        this.commitHash = commitHash;
        this.merkleRoot = merkleRoot;
        this.manifestRef = manifestRef;
        this.createdAt = createdAt;
    }

    public String getRepoRef() {
        return repoRef;
    }

    public long getIndex() {
        return index;
    }

    public String getContext() {
        return context;
    }

    public String getAuthor() {
        return author;
    }

    public String getCommitHash() {
        return commitHash;
    }

    public String getMerkleRoot() {
        return merkleRoot;
    }

    public String getManifestRef() {
        return manifestRef;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "Snapshot{" +
                "repoRef='" + repoRef + '\'' +
                ", index=" + index +
                ", merkleRoot='" + merkleRoot + '\'' +
                ", author='" + author + '\'' +
                '}';
    }
}
