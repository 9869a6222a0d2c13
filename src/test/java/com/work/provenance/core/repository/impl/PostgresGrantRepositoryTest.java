package com.work.provenance.core.repository.impl;

import com.work.provenance.core.model.Grant;
import com.work.provenance.core.model.Scope;
import com.work.provenance.core.repository.entity.GrantEntity;
import com.work.provenance.core.repository.mapper.GrantMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PostgresGrantRepositoryTest {

    private static final String P = "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266";
    private static final String R = "0x70997970c51812dc3a010c7d01b50e0d17dc79c8";
    private static final String CTX = "0x" + "ab".repeat(32);

    @Test
    public void all_sentinel_survives_numeric_column() {
        GrantMapper mapper = mock(GrantMapper.class);
        PostgresGrantRepository repository = new PostgresGrantRepository(mapper);

        repository.save(new Grant(P, R, CTX, Scope.ALL, 2000L));

        ArgumentCaptor<GrantEntity> saved = ArgumentCaptor.forClass(GrantEntity.class);
        verify(mapper).upsert(saved.capture());
        assertEquals(new BigDecimal(Scope.ALL), saved.getValue().getScopeMask());

        when(mapper.selectByKey(P, R, CTX)).thenReturn(saved.getValue());
        Optional<Grant> found = repository.find(P, R, CTX);
        assertEquals(Scope.ALL, found.get().getScopeMask());
        assertEquals(2000L, found.get().getExpiry());
    }

    @Test
    public void missing_row_is_empty() {
        GrantMapper mapper = mock(GrantMapper.class);
        assertFalse(new PostgresGrantRepository(mapper).find(P, R, CTX).isPresent());
    }
}
