package com.work.provenance.core.service;

import com.work.provenance.core.clock.LedgerClock;
import com.work.provenance.core.event.EventRecorder;
import com.work.provenance.core.exception.InvalidInputException;
import com.work.provenance.core.exception.NotFoundException;
import com.work.provenance.core.exception.PreconditionFailedException;
import com.work.provenance.core.exception.UnauthorizedException;
import com.work.provenance.core.execution.LedgerExecutor;
import com.work.provenance.core.model.LedgerEventType;
import com.work.provenance.core.model.Release;
import com.work.provenance.core.model.ReleaseStatus;
import com.work.provenance.core.model.Scope;
import com.work.provenance.core.model.SnapshotRef;
import com.work.provenance.core.repository.ReleaseRepository;
import com.work.provenance.core.support.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.work.provenance.core.event.EventRecorder.fields;
import static com.work.provenance.core.support.ValidationUtils.ZERO_ADDRESS;
import static com.work.provenance.core.support.ValidationUtils.requireAddress;
import static com.work.provenance.core.support.ValidationUtils.requireBytes32;
import static com.work.provenance.core.support.ValidationUtils.requireNonEmpty;
import static com.work.provenance.core.support.ValidationUtils.requireNonNegative;
import static com.work.provenance.core.support.ValidationUtils.requireNonNull;
import static com.work.provenance.core.support.ValidationUtils.requireNonZeroAddress;
import static com.work.provenance.core.support.ValidationUtils.requireNonZeroBytes32;

/**
 * release 状态机。
 * <p>
 * 状态：PENDING -> {ACCEPTED, REJECTED}，终态不可回退；revoked 是正交标记，任何治理状态下都可置位；
 * supersededBy 只能在 revoked 之后设置一次，且目标 release 必须未撤销，因此替代关系不会成环。
 * <p>
 * 所有写操作先完成全部校验再写入，失败不留下任何部分状态。
 */
public class ReleaseRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReleaseRegistry.class);

    private final ReleaseRepository releaseRepository;
    private final WorkspaceMembership membership;
    private final SnapshotLookup snapshots;
    private final DelegationEngine delegation;
    private final LedgerExecutor executor;
    private final EventRecorder eventRecorder;
    private final LedgerClock clock;
    private final LedgerMetrics metrics;

    public ReleaseRegistry(ReleaseRepository releaseRepository,
                           WorkspaceMembership membership,
                           SnapshotLookup snapshots,
                           DelegationEngine delegation,
                           EventRecorder eventRecorder,
                           LedgerExecutor executor,
                           LedgerClock clock,
                           LedgerMetrics metrics) {
        this.releaseRepository = releaseRepository;
        this.membership = membership;
        this.snapshots = snapshots;
        this.delegation = delegation;
        this.eventRecorder = eventRecorder;
        this.executor = executor;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * 锚定一个新 release，初始状态 PENDING。acting 必须是 author 本人或持有 author 的 RELEASE 授权。
     */
    public Release anchorRelease(String acting,
                                 String projectId,
                                 String id,
                                 String context,
                                 String manifestRef,
                                 String name,
                                 String author,
                                 String governanceAuthority,
                                 List<SnapshotRef> snapshotRefs) {
        String a = requireNonZeroAddress(acting, "acting");
        String project = requireNonZeroBytes32(projectId, "project");
        String releaseId = requireNonZeroBytes32(id, "id");
        String ctx = requireNonZeroBytes32(context, "context");
        String manifest = requireNonEmpty(manifestRef, "manifest");
        String releaseName = requireNonEmpty(name, "name");
        String au = requireNonZeroAddress(author, "author");
        String gov = requireNonZeroAddress(governanceAuthority, "governance");
        List<SnapshotRef> refs = normalizeRefs(snapshotRefs);

        return executor.execute("anchorRelease", () -> {
            delegation.requireActingFor(a, au, Scope.RELEASE, ctx);
            if (releaseRepository.findById(releaseId).isPresent()) {
                throw new PreconditionFailedException("release exists", "release id 已存在: " + releaseId);
            }
            if (!membership.isMember(ctx, au)) {
                throw new PreconditionFailedException("author not member", "author 不是 workspace 成员: " + au);
            }
            if (!membership.isMember(ctx, gov)) {
                throw new PreconditionFailedException("governance not member",
                        "governanceAuthority 不是 workspace 成员: " + gov);
            }
            for (SnapshotRef ref : refs) {
                if (!snapshots.exists(ref.getRepoRef(), ref.getRootRef())) {
                    throw new PreconditionFailedException("snapshot not found", "引用的快照不存在: " + ref);
                }
            }

            long now = clock.now();
            Release release = new Release(releaseId, project, ctx, manifest, releaseName, au, gov, now);
            releaseRepository.insert(release);
            eventRecorder.record(LedgerEventType.RELEASE_ANCHORED, now, fields(
                    "projectId", project,
                    "releaseId", releaseId,
                    "contextId", ctx,
                    "author", au,
                    "governanceAuthority", gov,
                    "manifestRef", manifest,
                    "name", releaseName,
                    "snapshots", refs.size()));
            metrics.stateCommitted("anchorRelease");
            log.info("release anchored id={} project={} author={} governance={} acting={} snapshots={}",
                    releaseId, project, au, gov, a, refs.size());
            return release;
        });
    }

    /**
     * 治理裁决。只允许 governanceAuthority、该 context 的 DAO executor，
     * 或持有 governanceAuthority 的 RELEASE 授权者调用。
     * 校验顺序：存在 -> 权限 -> 未撤销 -> PENDING。
     */
    public Release setGovernanceStatus(String acting, String id, ReleaseStatus newStatus) {
        String a = requireNonZeroAddress(acting, "acting");
        String releaseId = requireNonZeroBytes32(id, "id");
        requireNonNull(newStatus, "status");
        if (!newStatus.isTerminal()) {
            throw new InvalidInputException("bad status", "目标状态必须是 ACCEPTED 或 REJECTED: " + newStatus);
        }

        return executor.execute("setGovernanceStatus", () -> {
            Release release = requireRelease(releaseId);
            if (!canGovern(a, release)) {
                metrics.authorizationDenied("setGovernanceStatus");
                throw new UnauthorizedException("not governance", a + " 无权裁决 release " + releaseId);
            }
            if (release.isRevoked()) {
                throw new PreconditionFailedException("release revoked", "release 已撤销: " + releaseId);
            }
            if (release.getStatus() != ReleaseStatus.PENDING) {
                throw new PreconditionFailedException("not in pending status",
                        "release 不处于 PENDING 状态: " + releaseId + ", status=" + release.getStatus());
            }

            long now = clock.now();
            Release before = release.copy();
            release.applyGovernance(newStatus, a, now);
            writeFenced("setGovernanceStatus", before, release);
            eventRecorder.record(LedgerEventType.GOVERNANCE_STATUS_CHANGED, now, fields(
                    "releaseId", releaseId,
                    "status", newStatus.getCode(),
                    "actor", a));
            metrics.stateCommitted("setGovernanceStatus");
            log.info("release governance status changed id={} status={} actor={}", releaseId, newStatus, a);
            return release;
        });
    }

    public Release accept(String acting, String id) {
        return setGovernanceStatus(acting, id, ReleaseStatus.ACCEPTED);
    }

    public Release reject(String acting, String id) {
        return setGovernanceStatus(acting, id, ReleaseStatus.REJECTED);
    }

    /**
     * 配置 context 的 DAO executor。author 必须是该 context 成员，acting 为 author 本人或其 RELEASE 授权者。
     * executor 为零地址表示清除。
     */
    public void setDaoExecutor(String acting, String context, String author, String daoExecutor) {
        String a = requireNonZeroAddress(acting, "acting");
        String ctx = requireNonZeroBytes32(context, "context");
        String au = requireNonZeroAddress(author, "author");
        String exec = requireAddress(daoExecutor, "executor");

        executor.execute("setDaoExecutor", () -> {
            if (!membership.isMember(ctx, au)) {
                throw new PreconditionFailedException("author not member", "author 不是 workspace 成员: " + au);
            }
            delegation.requireActingFor(a, au, Scope.RELEASE, ctx);

            long now = clock.now();
            releaseRepository.saveDaoExecutor(ctx, ZERO_ADDRESS.equals(exec) ? null : exec, now);
            eventRecorder.record(LedgerEventType.DAO_EXECUTOR_SET, now, fields(
                    "contextId", ctx,
                    "executor", exec));
            metrics.stateCommitted("setDaoExecutor");
            log.info("dao executor set context={} executor={} author={} acting={}", ctx, exec, au, a);
        });
    }

    /**
     * 撤销 release。author 必须与记录中的 author 一致；不限制治理状态，重复撤销不报错。
     */
    public Release revokeRelease(String acting, String id, String author) {
        String a = requireNonZeroAddress(acting, "acting");
        String releaseId = requireNonZeroBytes32(id, "id");
        String au = requireNonZeroAddress(author, "author");

        return executor.execute("revokeRelease", () -> {
            Release release = requireRelease(releaseId);
            requireAuthor(release, au);
            delegation.requireActingFor(a, au, Scope.RELEASE, release.getContext());

            long now = clock.now();
            Release before = release.copy();
            release.markRevoked();
            writeFenced("revokeRelease", before, release);
            eventRecorder.record(LedgerEventType.RELEASE_REVOKED, now, fields(
                    "projectId", release.getProjectId(),
                    "releaseId", releaseId,
                    "author", au));
            metrics.stateCommitted("revokeRelease");
            log.info("release revoked id={} author={} acting={} status={}", releaseId, au, a, release.getStatus());
            return release;
        });
    }

    /**
     * 用 newId 替代已撤销的 oldId。两者必须属于同一项目，newId 不能是 oldId 本身，也不能已撤销。
     */
    public Release supersedeRelease(String acting, String oldId, String newId, String author) {
        String a = requireNonZeroAddress(acting, "acting");
        String from = requireNonZeroBytes32(oldId, "oldId");
        String to = requireNonZeroBytes32(newId, "newId");
        String au = requireNonZeroAddress(author, "author");
        if (from.equals(to)) {
            throw new InvalidInputException("same release", "release 不能替代自身: " + from);
        }

        return executor.execute("supersedeRelease", () -> {
            Release old = requireRelease(from);
            Release replacement = requireRelease(to);
            requireAuthor(old, au);
            delegation.requireActingFor(a, au, Scope.RELEASE, old.getContext());
            if (!old.isRevoked()) {
                throw new PreconditionFailedException("old release must be revoked", "旧 release 尚未撤销: " + from);
            }
            if (old.getSupersededBy() != null) {
                throw new PreconditionFailedException("already superseded",
                        "旧 release 已被替代: " + from + " -> " + old.getSupersededBy());
            }
            if (!old.getProjectId().equals(replacement.getProjectId())) {
                throw new PreconditionFailedException("project mismatch",
                        "新旧 release 不属于同一项目: " + old.getProjectId() + " / " + replacement.getProjectId());
            }
            if (replacement.isRevoked()) {
                throw new PreconditionFailedException("new release revoked", "新 release 已撤销: " + to);
            }

            long now = clock.now();
            Release before = old.copy();
            old.markSupersededBy(to);
            writeFenced("supersedeRelease", before, old);
            eventRecorder.record(LedgerEventType.RELEASE_SUPERSEDED, now, fields(
                    "projectId", old.getProjectId(),
                    "oldReleaseId", from,
                    "newReleaseId", to,
                    "author", au));
            metrics.stateCommitted("supersedeRelease");
            log.info("release superseded old={} new={} author={} acting={}", from, to, au, a);
            return old;
        });
    }

    public Release getReleaseById(String id) {
        return requireRelease(requireBytes32(id, "id"));
    }

    public ReleaseStatus getGovernanceStatus(String id) {
        return getReleaseById(id).getStatus();
    }

    public long getReleasesCount(String projectId) {
        return releaseRepository.countByProject(requireBytes32(projectId, "project"));
    }

    public Release getReleaseByIndex(String projectId, long index) {
        String project = requireBytes32(projectId, "project");
        requireNonNegative(index, "index");
        return releaseRepository.findByProjectIndex(project, index)
                .orElseThrow(() -> new NotFoundException("invalid index",
                        "release 不存在: project=" + project + ", index=" + index));
    }

    public List<Release> listReleases(String projectId, long offset, int limit) {
        String project = requireBytes32(projectId, "project");
        requireNonNegative(offset, "offset");
        return releaseRepository.listByProject(project, offset, limit);
    }

    public Optional<String> getDaoExecutor(String context) {
        return releaseRepository.findDaoExecutor(requireBytes32(context, "context"));
    }

    private boolean canGovern(String acting, Release release) {
        if (acting.equals(release.getGovernanceAuthority())) {
            return true;
        }
        Optional<String> dao = releaseRepository.findDaoExecutor(release.getContext());
        if (dao.isPresent() && dao.get().equals(acting)) {
            return true;
        }
        return delegation.isAuthorized(release.getGovernanceAuthority(), acting, Scope.RELEASE, release.getContext());
    }

    /**
     * 围栏写入失败说明其他节点在本步骤读取之后已修改该 release，整个步骤回滚。
     */
    private void writeFenced(String op, Release before, Release after) {
        if (!releaseRepository.compareAndUpdate(before, after)) {
            metrics.fencedWriteRejected(op);
            log.warn("fenced release write rejected op={} id={} expectedStatus={} expectedRevoked={}",
                    op, before.getId(), before.getStatus(), before.isRevoked());
            throw new PreconditionFailedException("concurrent update",
                    op + " 写入被拒绝，release 已被并发修改: " + before.getId());
        }
    }

    private Release requireRelease(String id) {
        return releaseRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("release not found", "release 不存在: " + id));
    }

    private static void requireAuthor(Release release, String author) {
        if (!release.getAuthor().equals(author)) {
            throw new UnauthorizedException("not author",
                    "author 与记录不一致: expected=" + release.getAuthor() + ", actual=" + author);
        }
    }

    private static List<SnapshotRef> normalizeRefs(List<SnapshotRef> snapshotRefs) {
        if (snapshotRefs == null || snapshotRefs.isEmpty()) {
            throw new InvalidInputException("no snapshots", "snapshotRefs 不能为空");
        }
        List<SnapshotRef> out = new ArrayList<>(snapshotRefs.size());
        for (SnapshotRef ref : snapshotRefs) {
            requireNonNull(ref, "snapshotRef");
            out.add(new SnapshotRef(requireBytes32(ref.getRepoRef(), "repo"), requireBytes32(ref.getRootRef(), "root")));
        }
        return out;
    }
}
