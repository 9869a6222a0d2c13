package com.work.provenance.core.model;

/**
 * 追加写的事件记录。seq 单调递增，payload 为 JSON 字符串。
 */
public class LedgerEvent {

    private final long seq;
    private final LedgerEventType type;
    private final String payload;
    private final long createdAt;

    public LedgerEvent(long seq, LedgerEventType type, String payload, long createdAt) {
        if (seq <= 0) {
            throw new IllegalArgumentException("seq 必须大于0");
        }
        if (type == null) {
            throw new IllegalArgumentException("type 不能为null");
        }
        this.seq = seq;
        this.type = type;
        this.payload = payload;
        this.createdAt = createdAt;
    }

    public long getSeq() {
        return seq;
    }

    public LedgerEventType getType() {
        return type;
    }

    public String getPayload() {
        return payload;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "LedgerEvent{" +
                "seq=" + seq +
                ", type=" + type.getEventName() +
                ", payload=" + payload +
                ", createdAt=" + createdAt +
                '}';
    }
}
