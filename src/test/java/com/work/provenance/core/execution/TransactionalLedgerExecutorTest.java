package com.work.provenance.core.execution;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TransactionalLedgerExecutorTest {

    @Test
    public void successful_step_commits_with_read_committed_and_timeout() {
        PlatformTransactionManager tm = mock(PlatformTransactionManager.class);
        SimpleTransactionStatus status = new SimpleTransactionStatus();
        when(tm.getTransaction(any())).thenReturn(status);

        TransactionalLedgerExecutor executor = new TransactionalLedgerExecutor(tm, 7);
        String out = executor.execute("registerGrant", () -> "ok");

        assertEquals("ok", out);
        ArgumentCaptor<TransactionDefinition> def = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(tm).getTransaction(def.capture());
        assertEquals(TransactionDefinition.ISOLATION_READ_COMMITTED, def.getValue().getIsolationLevel());
        assertEquals(7, def.getValue().getTimeout());
        verify(tm, times(1)).commit(status);
        verify(tm, never()).rollback(any());
    }

    @Test
    public void failing_step_rolls_back_and_rethrows() {
        PlatformTransactionManager tm = mock(PlatformTransactionManager.class);
        SimpleTransactionStatus status = new SimpleTransactionStatus();
        when(tm.getTransaction(any())).thenReturn(status);

        TransactionalLedgerExecutor executor = new TransactionalLedgerExecutor(tm, 10);
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> executor.execute("anchorRelease", () -> {
                    throw new IllegalStateException("boom");
                }));

        assertEquals("boom", e.getMessage());
        verify(tm, times(1)).rollback(status);
        verify(tm, never()).commit(any());
    }
}
