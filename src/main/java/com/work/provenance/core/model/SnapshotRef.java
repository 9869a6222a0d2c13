package com.work.provenance.core.model;

import java.util.Objects;

/**
 * release 引用的一个快照：(repoRef, rootRef)。
 */
public final class SnapshotRef {

    private final String repoRef;
    private final String rootRef;

    public SnapshotRef(String repoRef, String rootRef) {
        this.repoRef = repoRef;
        this.rootRef = rootRef;
    }

    public String getRepoRef() {
        return repoRef;
    }

    public String getRootRef() {
        return rootRef;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SnapshotRef that = (SnapshotRef) o;
        return repoRef.equals(that.repoRef) && rootRef.equals(that.rootRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(repoRef, rootRef);
    }

    @Override
    public String toString() {
        return repoRef + "@" + rootRef;
    }
}
