package com.work.provenance.core.service;

/**
 * 快照存在性查询端口，release 锚定时用来校验引用的快照。
 */
public interface SnapshotLookup {

    boolean exists(String repoRef, String rootRef);
}
