package com.work.provenance.core.repository.impl;

import com.work.provenance.core.exception.PreconditionFailedException;
import com.work.provenance.core.model.Snapshot;
import com.work.provenance.core.repository.entity.SnapshotEntity;
import com.work.provenance.core.repository.mapper.SnapshotMapper;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

public class PostgresSnapshotRepositoryTest {

    private static final String REPO = "0x" + "0c".repeat(32);
    private static final String CTX = "0x" + "ab".repeat(32);
    private static final String ROOT = "0x" + "0f".repeat(32);
    private static final String AUTHOR = "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266";

    private static Snapshot snapshot() {
        return new Snapshot(REPO, 0L, CTX, AUTHOR, "0x" + "11".repeat(32), ROOT, "ipfs://manifest", 1000L);
    }

    @Test
    public void duplicate_root_constraint_is_duplicate_root() {
        SnapshotMapper mapper = mock(SnapshotMapper.class);
        doThrow(new DuplicateKeyException("violates unique constraint \""
                + PostgresSnapshotRepository.ROOT_UNIQUE_KEY + "\"")).when(mapper).insertSnapshot(any(SnapshotEntity.class));

        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> new PostgresSnapshotRepository(mapper).insert(snapshot()));
        assertEquals("duplicate root", e.getReason());
    }

    @Test
    public void duplicate_index_is_concurrent_update() {
        SnapshotMapper mapper = mock(SnapshotMapper.class);
        doThrow(new DuplicateKeyException("violates unique constraint \"ledger_snapshot_pkey\""))
                .when(mapper).insertSnapshot(any(SnapshotEntity.class));

        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> new PostgresSnapshotRepository(mapper).insert(snapshot()));
        assertEquals("concurrent update", e.getReason());
    }
}
