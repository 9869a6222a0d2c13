package com.work.provenance.core.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.provenance.core.model.LedgerEvent;
import com.work.provenance.core.model.LedgerEventType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 将事件字段序列化为 JSON 后写入 {@link EventJournal}。
 */
public class EventRecorder {

    private final EventJournal journal;
    private final ObjectMapper objectMapper;

    public EventRecorder(EventJournal journal, ObjectMapper objectMapper) {
        this.journal = journal;
        this.objectMapper = objectMapper;
    }

    public LedgerEvent record(LedgerEventType type, long timestamp, Map<String, Object> fields) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("事件序列化失败: " + type.getEventName(), e);
        }
        return journal.append(type, payload, timestamp);
    }

    /**
     * 按 key/value 交替传参构造有序字段表，保证 payload 字段顺序与事件定义一致。
     */
    public static Map<String, Object> fields(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues 必须成对出现");
        }
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return m;
    }
}
