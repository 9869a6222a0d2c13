package com.work.provenance.server.config;

import com.work.provenance.core.event.EventJournal;
import com.work.provenance.core.execution.LedgerExecutor;
import com.work.provenance.core.execution.SerialLedgerExecutor;
import com.work.provenance.core.repository.GrantRepository;
import com.work.provenance.core.repository.NonceRepository;
import com.work.provenance.core.repository.ReleaseRepository;
import com.work.provenance.core.repository.SnapshotRepository;
import com.work.provenance.core.repository.WorkspaceRepository;
import com.work.provenance.core.support.InMemoryEventJournal;
import com.work.provenance.core.support.InMemoryGrantRepository;
import com.work.provenance.core.support.InMemoryNonceRepository;
import com.work.provenance.core.support.InMemoryReleaseRepository;
import com.work.provenance.core.support.InMemorySnapshotRepository;
import com.work.provenance.core.support.InMemoryWorkspaceRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ledger.store=memory 时启用：单进程内存存储，重启后数据丢失，仅用于本地调试与演示。
 */
@Configuration
@ConditionalOnProperty(prefix = "ledger", name = "store", havingValue = "memory")
public class InMemoryStoreConfiguration {

    @Bean
    public LedgerExecutor ledgerExecutor() {
        return new SerialLedgerExecutor();
    }

    @Bean
    public GrantRepository grantRepository() {
        return new InMemoryGrantRepository();
    }

    @Bean
    public NonceRepository nonceRepository() {
        return new InMemoryNonceRepository();
    }

    @Bean
    public WorkspaceRepository workspaceRepository() {
        return new InMemoryWorkspaceRepository();
    }

    @Bean
    public SnapshotRepository snapshotRepository() {
        return new InMemorySnapshotRepository();
    }

    @Bean
    public ReleaseRepository releaseRepository() {
        return new InMemoryReleaseRepository();
    }

    @Bean
    public EventJournal eventJournal() {
        return new InMemoryEventJournal();
    }
}
