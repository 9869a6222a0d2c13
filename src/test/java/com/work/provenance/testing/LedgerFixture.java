package com.work.provenance.testing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.provenance.core.config.LedgerConfig;
import com.work.provenance.core.crypto.EcdsaSignatureVerifier;
import com.work.provenance.core.event.EventRecorder;
import com.work.provenance.core.execution.SerialLedgerExecutor;
import com.work.provenance.core.service.DelegationEngine;
import com.work.provenance.core.service.ReleaseRegistry;
import com.work.provenance.core.service.SnapshotRegistry;
import com.work.provenance.core.service.WorkspaceRegistry;
import com.work.provenance.core.support.InMemoryEventJournal;
import com.work.provenance.core.support.InMemoryGrantRepository;
import com.work.provenance.core.support.InMemoryNonceRepository;
import com.work.provenance.core.support.InMemoryReleaseRepository;
import com.work.provenance.core.support.InMemorySnapshotRepository;
import com.work.provenance.core.support.InMemoryWorkspaceRepository;
import com.work.provenance.core.support.metrics.NoopLedgerMetrics;

/**
 * 全内存装配的账本，和 ledger.store=memory 时的 Spring 装配一致。
 */
public class LedgerFixture {

    public static final long T0 = 1_700_000_000L;

    public final MutableLedgerClock clock = new MutableLedgerClock(T0);
    public final LedgerConfig config;
    public final InMemoryEventJournal journal = new InMemoryEventJournal();
    public final InMemoryNonceRepository nonces = new InMemoryNonceRepository();
    public final DelegationEngine delegation;
    public final WorkspaceRegistry workspace;
    public final SnapshotRegistry snapshots;
    public final ReleaseRegistry releases;

    public LedgerFixture() {
        this(LedgerConfig.defaultConfig());
    }

    public LedgerFixture(LedgerConfig config) {
        this.config = config;
        SerialLedgerExecutor executor = new SerialLedgerExecutor();
        EventRecorder recorder = new EventRecorder(journal, new ObjectMapper());
        EcdsaSignatureVerifier verifier = new EcdsaSignatureVerifier();
        NoopLedgerMetrics metrics = new NoopLedgerMetrics();
        this.delegation = new DelegationEngine(new InMemoryGrantRepository(), nonces, verifier, recorder,
                executor, clock, config, metrics);
        this.workspace = new WorkspaceRegistry(new InMemoryWorkspaceRepository(), nonces, verifier, recorder,
                executor, clock, config, metrics);
        this.snapshots = new SnapshotRegistry(new InMemorySnapshotRepository(), workspace, delegation, recorder,
                executor, clock, metrics);
        this.releases = new ReleaseRegistry(new InMemoryReleaseRepository(), workspace, snapshots, delegation,
                recorder, executor, clock, metrics);
    }
}
