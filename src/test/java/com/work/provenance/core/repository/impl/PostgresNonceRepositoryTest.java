package com.work.provenance.core.repository.impl;

import com.work.provenance.core.repository.mapper.NonceCounterMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PostgresNonceRepositoryTest {

    @Test
    public void missing_row_reads_as_zero() {
        NonceCounterMapper mapper = mock(NonceCounterMapper.class);
        when(mapper.selectNonce(eq("delegation"), eq("0xabc"))).thenReturn(null);
        assertEquals(0L, new PostgresNonceRepository(mapper).currentNonce("delegation", "0xabc"));
    }

    @Test
    public void first_advance_creates_row_before_cas() {
        NonceCounterMapper mapper = mock(NonceCounterMapper.class);
        when(mapper.casAdvance(eq("delegation"), eq("0xabc"), eq(0L), anyLong())).thenReturn(1);

        int updated = new PostgresNonceRepository(mapper).compareAndAdvance("delegation", "0xabc", 0L);

        assertEquals(1, updated);
        verify(mapper, times(1)).insertIfNotExists(eq("delegation"), eq("0xabc"), anyLong());
    }

    @Test
    public void later_advance_is_plain_cas_and_reports_conflict() {
        NonceCounterMapper mapper = mock(NonceCounterMapper.class);
        when(mapper.casAdvance(eq("workspace"), eq("0xabc"), eq(3L), anyLong())).thenReturn(0);

        int updated = new PostgresNonceRepository(mapper).compareAndAdvance("workspace", "0xabc", 3L);

        assertEquals(0, updated);
        verify(mapper, never()).insertIfNotExists(eq("workspace"), eq("0xabc"), anyLong());
    }
}
