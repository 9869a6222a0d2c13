package com.work.provenance.core.service;

import com.work.provenance.core.clock.LedgerClock;
import com.work.provenance.core.event.EventRecorder;
import com.work.provenance.core.exception.NotFoundException;
import com.work.provenance.core.exception.PreconditionFailedException;
import com.work.provenance.core.execution.LedgerExecutor;
import com.work.provenance.core.model.LedgerEventType;
import com.work.provenance.core.model.Scope;
import com.work.provenance.core.model.Snapshot;
import com.work.provenance.core.repository.SnapshotRepository;
import com.work.provenance.core.support.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.work.provenance.core.event.EventRecorder.fields;
import static com.work.provenance.core.support.ValidationUtils.requireBytes32;
import static com.work.provenance.core.support.ValidationUtils.requireNonEmpty;
import static com.work.provenance.core.support.ValidationUtils.requireNonNegative;
import static com.work.provenance.core.support.ValidationUtils.requireNonZeroAddress;
import static com.work.provenance.core.support.ValidationUtils.requireNonZeroBytes32;

/**
 * 快照注册表：记录 repo 的源码快照，并作为 release 锚定时的存在性依据。
 */
public class SnapshotRegistry implements SnapshotLookup {

    private static final Logger log = LoggerFactory.getLogger(SnapshotRegistry.class);

    private final SnapshotRepository snapshotRepository;
    private final WorkspaceMembership membership;
    private final DelegationEngine delegation;
    private final LedgerExecutor executor;
    private final EventRecorder eventRecorder;
    private final LedgerClock clock;
    private final LedgerMetrics metrics;

    public SnapshotRegistry(SnapshotRepository snapshotRepository,
                            WorkspaceMembership membership,
                            DelegationEngine delegation,
                            EventRecorder eventRecorder,
                            LedgerExecutor executor,
                            LedgerClock clock,
                            LedgerMetrics metrics) {
        this.snapshotRepository = snapshotRepository;
        this.membership = membership;
        this.delegation = delegation;
        this.eventRecorder = eventRecorder;
        this.executor = executor;
        this.clock = clock;
        this.metrics = metrics;
    }

    public Snapshot createSnapshot(String acting,
                                   String repoRef,
                                   String context,
                                   String commitHash,
                                   String merkleRoot,
                                   String manifestRef,
                                   String author) {
        String a = requireNonZeroAddress(acting, "acting");
        String repo = requireNonZeroBytes32(repoRef, "repo");
        String ctx = requireNonZeroBytes32(context, "context");
        String commit = requireBytes32(commitHash, "commitHash");
        String root = requireNonZeroBytes32(merkleRoot, "root");
        String manifest = requireNonEmpty(manifestRef, "manifest");
        String au = requireNonZeroAddress(author, "author");

        return executor.execute("createSnapshot", () -> {
            delegation.requireActingFor(a, au, Scope.SNAPSHOT, ctx);
            if (!membership.isMember(ctx, au)) {
                throw new PreconditionFailedException("author not member", "author 不是 workspace 成员: " + au);
            }
            if (snapshotRepository.existsByRoot(repo, root)) {
                throw new PreconditionFailedException("duplicate root", "该 repo 已存在相同 merkleRoot 的快照: " + root);
            }
            long now = clock.now();
            long index = snapshotRepository.countByRepo(repo);
            Snapshot snapshot = new Snapshot(repo, index, ctx, au, commit, root, manifest, now);
            snapshotRepository.insert(snapshot);
            eventRecorder.record(LedgerEventType.SNAPSHOT_CREATED, now, fields(
                    "repoId", repo,
                    "index", index,
                    "contextId", ctx,
                    "author", au,
                    "commitHash", commit,
                    "merkleRoot", root,
                    "manifestRef", manifest));
            metrics.stateCommitted("createSnapshot");
            log.info("snapshot created repo={} index={} root={} author={} acting={}", repo, index, root, au, a);
            return snapshot;
        });
    }

    @Override
    public boolean exists(String repoRef, String rootRef) {
        return snapshotRepository.existsByRoot(requireBytes32(repoRef, "repo"), requireBytes32(rootRef, "root"));
    }

    public long getSnapshotsCount(String repoRef) {
        return snapshotRepository.countByRepo(requireBytes32(repoRef, "repo"));
    }

    public Snapshot getSnapshot(String repoRef, long index) {
        String repo = requireBytes32(repoRef, "repo");
        requireNonNegative(index, "index");
        return snapshotRepository.findByIndex(repo, index)
                .orElseThrow(() -> new NotFoundException("invalid index", "快照不存在: repo=" + repo + ", index=" + index));
    }

    public Snapshot getSnapshotByRoot(String repoRef, String merkleRoot) {
        String repo = requireBytes32(repoRef, "repo");
        String root = requireBytes32(merkleRoot, "root");
        return snapshotRepository.findByRoot(repo, root)
                .orElseThrow(() -> new NotFoundException("not found", "快照不存在: repo=" + repo + ", root=" + root));
    }
}
