package com.work.provenance.core.event;

import com.work.provenance.core.model.LedgerEvent;
import com.work.provenance.core.model.LedgerEventType;

import java.util.List;

/**
 * 追加写的事件日志。append 必须与其记录的状态变更处于同一个串行化步骤内。
 */
public interface EventJournal {

    LedgerEvent append(LedgerEventType type, String payload, long createdAt);

    /**
     * poll-only 读取：返回 seq 大于 afterSeq 的事件，按 seq 升序。afterSeq 为 null 表示从头开始。
     */
    List<LedgerEvent> listAfter(Long afterSeq, int limit);
}
