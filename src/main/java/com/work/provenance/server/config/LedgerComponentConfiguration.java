package com.work.provenance.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.provenance.core.clock.LedgerClock;
import com.work.provenance.core.clock.SystemLedgerClock;
import com.work.provenance.core.config.LedgerConfig;
import com.work.provenance.core.crypto.EcdsaSignatureVerifier;
import com.work.provenance.core.crypto.SignatureVerifier;
import com.work.provenance.core.event.EventJournal;
import com.work.provenance.core.event.EventRecorder;
import com.work.provenance.core.execution.LedgerExecutor;
import com.work.provenance.core.repository.GrantRepository;
import com.work.provenance.core.repository.NonceRepository;
import com.work.provenance.core.repository.ReleaseRepository;
import com.work.provenance.core.repository.SnapshotRepository;
import com.work.provenance.core.repository.WorkspaceRepository;
import com.work.provenance.core.service.DelegationEngine;
import com.work.provenance.core.service.ReleaseRegistry;
import com.work.provenance.core.service.SnapshotRegistry;
import com.work.provenance.core.service.WorkspaceRegistry;
import com.work.provenance.core.support.ValidationUtils;
import com.work.provenance.core.support.metrics.LedgerMetrics;
import com.work.provenance.core.support.metrics.NoopLedgerMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 将核心组件装配为 Spring Bean。存储相关的 Bean 由
 * {@link PostgresStoreConfiguration} 或 {@link InMemoryStoreConfiguration} 按 ledger.store 提供。
 */
@Configuration
@EnableConfigurationProperties({LedgerProperties.class, ChainProperties.class})
public class LedgerComponentConfiguration {

    @Bean
    public LedgerConfig ledgerConfig(LedgerProperties properties, ChainProperties chain) {
        return LedgerConfig.of(
                chain.getChainId(),
                ValidationUtils.requireAddress(properties.getDelegationContract(), "ledger.delegation-contract"),
                properties.getDelegationDomainVersion(),
                ValidationUtils.requireAddress(properties.getWorkspaceContract(), "ledger.workspace-contract"),
                properties.getWorkspaceDomainVersion(),
                (int) properties.getTxTimeout().getSeconds());
    }

    /**
     * 默认使用本机时钟；若设置 chain.mode=web3j，将由 Web3jConfiguration 提供区块时间实现
     */
    @Bean
    @ConditionalOnMissingBean(LedgerClock.class)
    public LedgerClock ledgerClock() {
        return new SystemLedgerClock();
    }

    @Bean
    @ConditionalOnMissingBean(SignatureVerifier.class)
    public SignatureVerifier signatureVerifier() {
        return new EcdsaSignatureVerifier();
    }

    /**
     * 默认 no-op；平台可自定义 LedgerMetrics Bean 接入 Prometheus 等
     */
    @Bean
    @ConditionalOnMissingBean(LedgerMetrics.class)
    public LedgerMetrics ledgerMetrics() {
        return new NoopLedgerMetrics();
    }

    @Bean
    public EventRecorder eventRecorder(EventJournal journal, ObjectMapper objectMapper) {
        return new EventRecorder(journal, objectMapper);
    }

    @Bean
    public DelegationEngine delegationEngine(GrantRepository grantRepository,
                                             NonceRepository nonceRepository,
                                             SignatureVerifier signatureVerifier,
                                             EventRecorder eventRecorder,
                                             LedgerExecutor ledgerExecutor,
                                             LedgerClock ledgerClock,
                                             LedgerConfig ledgerConfig,
                                             LedgerMetrics ledgerMetrics) {
        return new DelegationEngine(grantRepository, nonceRepository, signatureVerifier, eventRecorder,
                ledgerExecutor, ledgerClock, ledgerConfig, ledgerMetrics);
    }

    @Bean
    public WorkspaceRegistry workspaceRegistry(WorkspaceRepository workspaceRepository,
                                               NonceRepository nonceRepository,
                                               SignatureVerifier signatureVerifier,
                                               EventRecorder eventRecorder,
                                               LedgerExecutor ledgerExecutor,
                                               LedgerClock ledgerClock,
                                               LedgerConfig ledgerConfig,
                                               LedgerMetrics ledgerMetrics) {
        return new WorkspaceRegistry(workspaceRepository, nonceRepository, signatureVerifier, eventRecorder,
                ledgerExecutor, ledgerClock, ledgerConfig, ledgerMetrics);
    }

    @Bean
    public SnapshotRegistry snapshotRegistry(SnapshotRepository snapshotRepository,
                                             WorkspaceRegistry workspaceRegistry,
                                             DelegationEngine delegationEngine,
                                             EventRecorder eventRecorder,
                                             LedgerExecutor ledgerExecutor,
                                             LedgerClock ledgerClock,
                                             LedgerMetrics ledgerMetrics) {
        return new SnapshotRegistry(snapshotRepository, workspaceRegistry, delegationEngine, eventRecorder,
                ledgerExecutor, ledgerClock, ledgerMetrics);
    }

    @Bean
    public ReleaseRegistry releaseRegistry(ReleaseRepository releaseRepository,
                                           WorkspaceRegistry workspaceRegistry,
                                           SnapshotRegistry snapshotRegistry,
                                           DelegationEngine delegationEngine,
                                           EventRecorder eventRecorder,
                                           LedgerExecutor ledgerExecutor,
                                           LedgerClock ledgerClock,
                                           LedgerMetrics ledgerMetrics) {
        return new ReleaseRegistry(releaseRepository, workspaceRegistry, snapshotRegistry, delegationEngine,
                eventRecorder, ledgerExecutor, ledgerClock, ledgerMetrics);
    }
}
