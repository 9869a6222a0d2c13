package com.work.provenance.core.repository.impl;

import com.work.provenance.core.repository.mapper.WorkspaceMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PostgresWorkspaceRepositoryTest {

    private static final String CTX = "0x" + "ab".repeat(32);
    private static final String ALICE = "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266";
    private static final String BOB = "0x70997970c51812dc3a010c7d01b50e0d17dc79c8";

    @Test
    public void authority_insert_reports_existing_row() {
        WorkspaceMapper mapper = mock(WorkspaceMapper.class);
        PostgresWorkspaceRepository repository = new PostgresWorkspaceRepository(mapper);

        when(mapper.insertAuthorityIfAbsent(CTX, ALICE, 10L)).thenReturn(1);
        assertTrue(repository.insertAuthorityIfAbsent(CTX, ALICE, 10L));

        when(mapper.insertAuthorityIfAbsent(CTX, BOB, 11L)).thenReturn(0);
        assertFalse(repository.insertAuthorityIfAbsent(CTX, BOB, 11L));
    }

    @Test
    public void authority_rotation_is_fenced_on_expected_authority() {
        WorkspaceMapper mapper = mock(WorkspaceMapper.class);
        PostgresWorkspaceRepository repository = new PostgresWorkspaceRepository(mapper);

        assertFalse(repository.compareAndSetAuthority(CTX, ALICE, BOB, 20L));
        verify(mapper).updateAuthorityFenced(CTX, ALICE, BOB, 20L);

        when(mapper.updateAuthorityFenced(CTX, ALICE, BOB, 21L)).thenReturn(1);
        assertTrue(repository.compareAndSetAuthority(CTX, ALICE, BOB, 21L));
    }

    @Test
    public void membership_reads_active_flag() {
        WorkspaceMapper mapper = mock(WorkspaceMapper.class);
        PostgresWorkspaceRepository repository = new PostgresWorkspaceRepository(mapper);

        when(mapper.selectAuthority(CTX)).thenReturn(ALICE);
        assertEquals(ALICE, repository.findAuthority(CTX).get());
        assertFalse(repository.findAuthority("0x" + "cd".repeat(32)).isPresent());

        when(mapper.selectMemberActive(CTX, ALICE)).thenReturn(Boolean.TRUE);
        when(mapper.selectMemberActive(CTX, BOB)).thenReturn(Boolean.FALSE);
        assertTrue(repository.isMember(CTX, ALICE));
        assertFalse(repository.isMember(CTX, BOB));
        assertFalse(repository.isMember(CTX, "0x3c44cdddb6a900fa2b585dd299e03d12fa4293bc"));

        repository.setMember(CTX, BOB, false, 30L);
        verify(mapper).upsertMember(CTX, BOB, false, 30L);
    }
}
