package com.work.provenance.core.repository.impl;

import com.work.provenance.core.exception.PreconditionFailedException;
import com.work.provenance.core.model.Release;
import com.work.provenance.core.model.ReleaseStatus;
import com.work.provenance.core.repository.entity.ReleaseEntity;
import com.work.provenance.core.repository.mapper.ReleaseMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PostgresReleaseRepositoryTest {

    private static final String ID = "0x" + "01".repeat(32);
    private static final String NEXT_ID = "0x" + "02".repeat(32);
    private static final String PROJECT = "0x" + "0a".repeat(32);
    private static final String CTX = "0x" + "ab".repeat(32);
    private static final String AUTHOR = "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266";
    private static final String GOV = "0x70997970c51812dc3a010c7d01b50e0d17dc79c8";

    private static Release pending() {
        return new Release(ID, PROJECT, CTX, "ipfs://release", "v1", AUTHOR, GOV, 1000L);
    }

    @Test
    public void insert_assigns_next_project_index_and_maps_fields() {
        ReleaseMapper mapper = mock(ReleaseMapper.class);
        when(mapper.countByProject(PROJECT)).thenReturn(4L);
        PostgresReleaseRepository repository = new PostgresReleaseRepository(mapper);

        repository.insert(pending());

        ArgumentCaptor<ReleaseEntity> inserted = ArgumentCaptor.forClass(ReleaseEntity.class);
        verify(mapper).insert(inserted.capture());
        ReleaseEntity e = inserted.getValue();
        assertEquals(4L, e.getProjectIndex());
        assertEquals(CTX, e.getContextId());
        assertEquals(GOV, e.getGovernanceAuthority());
        assertEquals(ReleaseStatus.PENDING.getCode(), e.getStatus());
        assertFalse(e.getRevoked());
        assertNull(e.getSupersededBy());

        when(mapper.selectById(ID)).thenReturn(e);
        Release found = repository.findById(ID).get();
        assertEquals(pending(), found);
        assertEquals(ReleaseStatus.PENDING, found.getStatus());
        assertEquals(0L, found.getStatusTimestamp());
    }

    @Test
    public void null_status_columns_read_back_as_defaults() {
        ReleaseMapper mapper = mock(ReleaseMapper.class);
        ReleaseEntity e = new ReleaseEntity();
        e.setId(ID);
        e.setProjectId(PROJECT);
        e.setContextId(CTX);
        e.setManifestRef("ipfs://release");
        e.setName("v1");
        e.setAuthor(AUTHOR);
        e.setGovernanceAuthority(GOV);
        e.setCreatedAt(1000L);
        e.setStatus(ReleaseStatus.ACCEPTED.getCode());
        when(mapper.selectById(ID)).thenReturn(e);

        Release found = new PostgresReleaseRepository(mapper).findById(ID).get();
        assertEquals(ReleaseStatus.ACCEPTED, found.getStatus());
        assertFalse(found.isRevoked());
        assertEquals(0L, found.getStatusTimestamp());
    }

    @Test
    public void fenced_update_passes_expected_state_and_reports_zero_rows() {
        ReleaseMapper mapper = mock(ReleaseMapper.class);
        PostgresReleaseRepository repository = new PostgresReleaseRepository(mapper);
        Release before = pending();
        Release after = before.copy();
        after.markRevoked();
        after.markSupersededBy(NEXT_ID);

        when(mapper.updateMutableFenced(any(ReleaseEntity.class), anyInt(), anyBoolean(), isNull())).thenReturn(0);
        assertFalse(repository.compareAndUpdate(before, after));

        ArgumentCaptor<ReleaseEntity> written = ArgumentCaptor.forClass(ReleaseEntity.class);
        verify(mapper).updateMutableFenced(written.capture(), eq(ReleaseStatus.PENDING.getCode()), eq(false), isNull());
        assertTrue(written.getValue().getRevoked());
        assertEquals(NEXT_ID, written.getValue().getSupersededBy());

        when(mapper.updateMutableFenced(any(ReleaseEntity.class), anyInt(), anyBoolean(), isNull())).thenReturn(1);
        assertTrue(repository.compareAndUpdate(before, after));
    }

    @Test
    public void duplicate_primary_key_is_release_exists() {
        ReleaseMapper mapper = mock(ReleaseMapper.class);
        when(mapper.insert(any(ReleaseEntity.class))).thenThrow(new DuplicateKeyException(
                "duplicate key value violates unique constraint \"" + PostgresReleaseRepository.PRIMARY_KEY + "\""));

        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> new PostgresReleaseRepository(mapper).insert(pending()));
        assertEquals("release exists", e.getReason());
    }

    @Test
    public void duplicate_project_index_is_concurrent_update() {
        ReleaseMapper mapper = mock(ReleaseMapper.class);
        when(mapper.insert(any(ReleaseEntity.class))).thenThrow(new DuplicateKeyException(
                "duplicate key value violates unique constraint \"ledger_release_project_id_project_index_key\""));

        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> new PostgresReleaseRepository(mapper).insert(pending()));
        assertEquals("concurrent update", e.getReason());
    }
}
