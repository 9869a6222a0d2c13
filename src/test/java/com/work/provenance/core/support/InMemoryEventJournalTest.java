package com.work.provenance.core.support;

import com.work.provenance.core.model.LedgerEvent;
import com.work.provenance.core.model.LedgerEventType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InMemoryEventJournalTest {

    @Test
    public void seq_starts_at_one_and_cursor_is_exclusive() {
        InMemoryEventJournal journal = new InMemoryEventJournal();
        for (int i = 0; i < 5; i++) {
            journal.append(LedgerEventType.MEMBER_SET, "{\"i\":" + i + "}", 100L + i);
        }

        List<LedgerEvent> all = journal.listAfter(null, 50);
        assertEquals(5, all.size());
        assertEquals(1L, all.get(0).getSeq());

        List<LedgerEvent> tail = journal.listAfter(3L, 50);
        assertEquals(2, tail.size());
        assertEquals(4L, tail.get(0).getSeq());

        assertEquals(2, journal.listAfter(0L, 2).size());
        assertTrue(journal.listAfter(5L, 50).isEmpty());
        assertTrue(journal.listAfter(99L, 50).isEmpty());
    }
}
