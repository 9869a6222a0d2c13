package com.work.provenance.core.repository.impl;

import com.work.provenance.core.event.EventJournal;
import com.work.provenance.core.model.LedgerEvent;
import com.work.provenance.core.model.LedgerEventType;
import com.work.provenance.core.repository.entity.LedgerEventEntity;
import com.work.provenance.core.repository.mapper.LedgerEventMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 PostgreSQL 的事件日志，seq 由 BIGSERIAL 生成，随账本步骤的事务一起提交或回滚。
 */
public class PostgresEventJournal implements EventJournal {

    private final LedgerEventMapper eventMapper;

    public PostgresEventJournal(LedgerEventMapper eventMapper) {
        this.eventMapper = eventMapper;
    }

    @Override
    public LedgerEvent append(LedgerEventType type, String payload, long createdAt) {
        LedgerEventEntity entity = new LedgerEventEntity();
        entity.setEventType(type.getEventName());
        entity.setPayload(payload);
        entity.setCreatedAt(createdAt);
        eventMapper.insertEvent(entity);
        if (entity.getSeq() == null) {
            throw new IllegalStateException("事件写入后未回填 seq: " + type.getEventName());
        }
        return new LedgerEvent(entity.getSeq(), type, payload, createdAt);
    }

    @Override
    public List<LedgerEvent> listAfter(Long afterSeq, int limit) {
        List<LedgerEventEntity> rows = eventMapper.listAfterSeq(afterSeq, limit);
        List<LedgerEvent> out = new ArrayList<>(rows.size());
        for (LedgerEventEntity row : rows) {
            out.add(new LedgerEvent(row.getSeq(), LedgerEventType.fromEventName(row.getEventType()),
                    row.getPayload(), row.getCreatedAt()));
        }
        return out;
    }
}
