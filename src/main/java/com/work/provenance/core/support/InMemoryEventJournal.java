package com.work.provenance.core.support;

import com.work.provenance.core.event.EventJournal;
import com.work.provenance.core.model.LedgerEvent;
import com.work.provenance.core.model.LedgerEventType;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 纯内存事件日志，seq 从 1 开始。
 */
public class InMemoryEventJournal implements EventJournal {

    private final List<LedgerEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicLong seqGenerator = new AtomicLong(0L);

    @Override
    public synchronized LedgerEvent append(LedgerEventType type, String payload, long createdAt) {
        LedgerEvent event = new LedgerEvent(seqGenerator.incrementAndGet(), type, payload, createdAt);
        events.add(event);
        return event;
    }

    @Override
    public List<LedgerEvent> listAfter(Long afterSeq, int limit) {
        long after = afterSeq == null ? 0L : afterSeq;
        List<LedgerEvent> out = new ArrayList<>();
        // seq 与下标一一对应：seq = index + 1
        int from = (int) Math.min(Math.max(after, 0L), (long) events.size());
        for (int i = from; i < events.size() && out.size() < limit; i++) {
            out.add(events.get(i));
        }
        return out;
    }
}
