package com.work.provenance.server.config;

import com.work.provenance.core.config.LedgerConfig;
import com.work.provenance.core.event.EventJournal;
import com.work.provenance.core.execution.LedgerExecutor;
import com.work.provenance.core.execution.TransactionalLedgerExecutor;
import com.work.provenance.core.repository.GrantRepository;
import com.work.provenance.core.repository.NonceRepository;
import com.work.provenance.core.repository.ReleaseRepository;
import com.work.provenance.core.repository.SnapshotRepository;
import com.work.provenance.core.repository.WorkspaceRepository;
import com.work.provenance.core.repository.impl.PostgresEventJournal;
import com.work.provenance.core.repository.impl.PostgresGrantRepository;
import com.work.provenance.core.repository.impl.PostgresNonceRepository;
import com.work.provenance.core.repository.impl.PostgresReleaseRepository;
import com.work.provenance.core.repository.impl.PostgresSnapshotRepository;
import com.work.provenance.core.repository.impl.PostgresWorkspaceRepository;
import com.work.provenance.core.repository.mapper.GrantMapper;
import com.work.provenance.core.repository.mapper.LedgerEventMapper;
import com.work.provenance.core.repository.mapper.NonceCounterMapper;
import com.work.provenance.core.repository.mapper.ReleaseMapper;
import com.work.provenance.core.repository.mapper.SnapshotMapper;
import com.work.provenance.core.repository.mapper.WorkspaceMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * ledger.store=postgres（默认）时启用：MyBatis-Plus + PostgreSQL 存储，
 * 每个账本步骤在一个 READ_COMMITTED 事务内执行。
 */
@Configuration
@ConditionalOnProperty(prefix = "ledger", name = "store", havingValue = "postgres", matchIfMissing = true)
@MapperScan("com.work.provenance.core.repository.mapper")
public class PostgresStoreConfiguration {

    @Bean
    public LedgerExecutor ledgerExecutor(PlatformTransactionManager transactionManager, LedgerConfig ledgerConfig) {
        return new TransactionalLedgerExecutor(transactionManager, ledgerConfig.getTxTimeoutSeconds());
    }

    @Bean
    public GrantRepository grantRepository(GrantMapper mapper) {
        return new PostgresGrantRepository(mapper);
    }

    @Bean
    public NonceRepository nonceRepository(NonceCounterMapper mapper) {
        return new PostgresNonceRepository(mapper);
    }

    @Bean
    public WorkspaceRepository workspaceRepository(WorkspaceMapper mapper) {
        return new PostgresWorkspaceRepository(mapper);
    }

    @Bean
    public SnapshotRepository snapshotRepository(SnapshotMapper mapper) {
        return new PostgresSnapshotRepository(mapper);
    }

    @Bean
    public ReleaseRepository releaseRepository(ReleaseMapper mapper) {
        return new PostgresReleaseRepository(mapper);
    }

    @Bean
    public EventJournal eventJournal(LedgerEventMapper mapper) {
        return new PostgresEventJournal(mapper);
    }
}
