package com.work.provenance.core.model;

/**
 * 事件日志中的事实类型，名称与链上事件保持一致。
 */
public enum LedgerEventType {
    DELEGATED("Delegated"),
    REVOKED("Revoked"),
    AUTHORITY_SET("AuthoritySet"),
    MEMBER_SET("MemberSet"),
    SNAPSHOT_CREATED("SnapshotCreated"),
    RELEASE_ANCHORED("ReleaseAnchored"),
    GOVERNANCE_STATUS_CHANGED("GovernanceStatusChanged"),
    DAO_EXECUTOR_SET("DaoExecutorSet"),
    RELEASE_REVOKED("ReleaseRevoked"),
    RELEASE_SUPERSEDED("ReleaseSuperseded");

    private final String eventName;

    LedgerEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }

    public static LedgerEventType fromEventName(String eventName) {
        for (LedgerEventType t : values()) {
            if (t.eventName.equals(eventName)) {
                return t;
            }
        }
        throw new IllegalArgumentException("未知的事件类型: " + eventName);
    }
}
