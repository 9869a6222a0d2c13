package com.work.provenance.core.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.provenance.core.crypto.DelegatePayload;
import com.work.provenance.core.crypto.SetMemberPayload;
import com.work.provenance.core.event.EventRecorder;
import com.work.provenance.core.exception.InvalidInputException;
import com.work.provenance.core.exception.NotFoundException;
import com.work.provenance.core.exception.PreconditionFailedException;
import com.work.provenance.core.exception.UnauthorizedException;
import com.work.provenance.core.execution.SerialLedgerExecutor;
import com.work.provenance.core.model.LedgerEvent;
import com.work.provenance.core.model.LedgerEventType;
import com.work.provenance.core.model.Release;
import com.work.provenance.core.model.ReleaseStatus;
import com.work.provenance.core.model.Scope;
import com.work.provenance.core.model.SnapshotRef;
import com.work.provenance.core.repository.ReleaseRepository;
import com.work.provenance.core.support.InMemoryEventJournal;
import com.work.provenance.core.support.ValidationUtils;
import com.work.provenance.core.support.metrics.LedgerMetrics;
import com.work.provenance.core.support.metrics.NoopLedgerMetrics;
import com.work.provenance.testing.Hex32;
import com.work.provenance.testing.LedgerFixture;
import com.work.provenance.testing.TestSigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.work.provenance.testing.LedgerFixture.T0;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ReleaseRegistryTest {

    private static final TestSigner ALICE = TestSigner.ALICE;
    private static final TestSigner BOB = TestSigner.BOB;
    private static final TestSigner CAROL = TestSigner.CAROL;
    private static final TestSigner DAVE = TestSigner.DAVE;

    private final String ctx = Hex32.id("workspace");
    private final String repo = Hex32.id("repo");
    private final String root = Hex32.id("root-1");
    private final String project = Hex32.id("project");
    private final String rel1 = Hex32.id("release-1");
    private final String rel2 = Hex32.id("release-2");
    private final long deadline = T0 + 600;

    private LedgerFixture ledger;

    @BeforeEach
    public void setUp() {
        ledger = new LedgerFixture();
        ledger.workspace.initAuthority(ctx, ALICE.address());
        addMember(BOB.address());
        ledger.snapshots.createSnapshot(ALICE.address(), repo, ctx, Hex32.id("commit"), root,
                "ipfs://snapshot", ALICE.address());
    }

    private void addMember(String member) {
        long nonce = ledger.workspace.nonceOf(ALICE.address());
        SetMemberPayload payload = new SetMemberPayload(ctx, member, true, nonce, deadline);
        ledger.workspace.setMemberWithSig(ctx, member, true, deadline,
                ALICE.sign(ledger.config.getWorkspaceDomain(), payload));
    }

    private void delegate(TestSigner owner, String relayer, Scope scope) {
        long nonce = ledger.delegation.nonceOf(owner.address());
        BigInteger mask = scope.mask();
        DelegatePayload payload = new DelegatePayload(owner.address(), relayer, ctx, mask, nonce, T0 + 3600, deadline);
        ledger.delegation.registerGrant(owner.address(), relayer, ctx, mask, T0 + 3600, deadline,
                owner.sign(ledger.config.getDelegationDomain(), payload));
    }

    private Release anchor(String acting, String id) {
        return ledger.releases.anchorRelease(acting, project, id, ctx, "ipfs://release", "v1.0.0",
                ALICE.address(), BOB.address(), Collections.singletonList(new SnapshotRef(repo, root)));
    }

    @Test
    public void anchored_release_starts_pending_and_governance_accepts_once() {
        Release anchored = anchor(ALICE.address(), rel1);
        assertEquals(ReleaseStatus.PENDING, anchored.getStatus());
        assertEquals(T0, anchored.getCreatedAt());
        assertEquals(1L, ledger.releases.getReleasesCount(project));

        ledger.clock.advance(30);
        Release accepted = ledger.releases.accept(BOB.address(), rel1);
        assertEquals(ReleaseStatus.ACCEPTED, accepted.getStatus());
        assertEquals(BOB.address(), accepted.getStatusAuthor());
        assertEquals(T0 + 30, accepted.getStatusTimestamp());
        assertEquals(ReleaseStatus.ACCEPTED, ledger.releases.getGovernanceStatus(rel1));

        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> ledger.releases.reject(BOB.address(), rel1));
        assertEquals("not in pending status", e.getReason());
    }

    @Test
    public void non_governance_caller_cannot_set_status() {
        anchor(ALICE.address(), rel1);

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> ledger.releases.accept(CAROL.address(), rel1));
        assertEquals("not governance", e.getReason());
        assertEquals(ReleaseStatus.PENDING, ledger.releases.getGovernanceStatus(rel1));
    }

    @Test
    public void pending_is_not_a_valid_target_status() {
        anchor(ALICE.address(), rel1);
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> ledger.releases.setGovernanceStatus(BOB.address(), rel1, ReleaseStatus.PENDING));
        assertEquals("bad status", e.getReason());
    }

    @Test
    public void governance_delegate_and_dao_executor_may_decide() {
        anchor(ALICE.address(), rel1);
        anchor(ALICE.address(), rel2);

        delegate(BOB, DAVE.address(), Scope.RELEASE);
        assertEquals(ReleaseStatus.REJECTED, ledger.releases.reject(DAVE.address(), rel1).getStatus());

        ledger.releases.setDaoExecutor(ALICE.address(), ctx, ALICE.address(), CAROL.address());
        assertEquals(CAROL.address(), ledger.releases.getDaoExecutor(ctx).get());
        assertEquals(ReleaseStatus.ACCEPTED, ledger.releases.accept(CAROL.address(), rel2).getStatus());
    }

    @Test
    public void zero_executor_clears_dao_executor() {
        ledger.releases.setDaoExecutor(ALICE.address(), ctx, ALICE.address(), CAROL.address());
        ledger.releases.setDaoExecutor(ALICE.address(), ctx, ALICE.address(), ValidationUtils.ZERO_ADDRESS);
        assertFalse(ledger.releases.getDaoExecutor(ctx).isPresent());
    }

    @Test
    public void dao_executor_requires_member_author_and_release_scope() {
        PreconditionFailedException notMember = assertThrows(PreconditionFailedException.class,
                () -> ledger.releases.setDaoExecutor(CAROL.address(), ctx, CAROL.address(), DAVE.address()));
        assertEquals("author not member", notMember.getReason());

        assertThrows(UnauthorizedException.class,
                () -> ledger.releases.setDaoExecutor(DAVE.address(), ctx, ALICE.address(), DAVE.address()));
    }

    @Test
    public void relayer_with_release_scope_can_anchor_for_author() {
        assertThrows(UnauthorizedException.class, () -> anchor(DAVE.address(), rel1));

        delegate(ALICE, DAVE.address(), Scope.RELEASE);
        Release r = anchor(DAVE.address(), rel1);
        assertEquals(ALICE.address(), r.getAuthor());
    }

    @Test
    public void anchor_preconditions_are_enforced() {
        anchor(ALICE.address(), rel1);
        PreconditionFailedException exists = assertThrows(PreconditionFailedException.class,
                () -> anchor(ALICE.address(), rel1));
        assertEquals("release exists", exists.getReason());

        PreconditionFailedException gov = assertThrows(PreconditionFailedException.class,
                () -> ledger.releases.anchorRelease(ALICE.address(), project, rel2, ctx, "ipfs://release", "v2",
                        ALICE.address(), CAROL.address(), Collections.singletonList(new SnapshotRef(repo, root))));
        assertEquals("governance not member", gov.getReason());

        PreconditionFailedException missing = assertThrows(PreconditionFailedException.class,
                () -> ledger.releases.anchorRelease(ALICE.address(), project, rel2, ctx, "ipfs://release", "v2",
                        ALICE.address(), BOB.address(),
                        Collections.singletonList(new SnapshotRef(repo, Hex32.id("unknown-root")))));
        assertEquals("snapshot not found", missing.getReason());

        InvalidInputException empty = assertThrows(InvalidInputException.class,
                () -> ledger.releases.anchorRelease(ALICE.address(), project, rel2, ctx, "ipfs://release", "v2",
                        ALICE.address(), BOB.address(), Collections.emptyList()));
        assertEquals("no snapshots", empty.getReason());
        assertEquals(1L, ledger.releases.getReleasesCount(project));
    }

    @Test
    public void revoke_is_author_only_and_idempotent() {
        anchor(ALICE.address(), rel1);
        ledger.releases.accept(BOB.address(), rel1);

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> ledger.releases.revokeRelease(BOB.address(), rel1, BOB.address()));
        assertEquals("not author", e.getReason());

        Release revoked = ledger.releases.revokeRelease(ALICE.address(), rel1, ALICE.address());
        assertTrue(revoked.isRevoked());
        assertEquals(ReleaseStatus.ACCEPTED, revoked.getStatus());
        assertTrue(ledger.releases.revokeRelease(ALICE.address(), rel1, ALICE.address()).isRevoked());
    }

    @Test
    public void revoked_pending_release_cannot_be_decided() {
        anchor(ALICE.address(), rel1);
        ledger.releases.revokeRelease(ALICE.address(), rel1, ALICE.address());

        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> ledger.releases.accept(BOB.address(), rel1));
        assertEquals("release revoked", e.getReason());
    }

    @Test
    public void supersede_requires_revoked_old_release() {
        anchor(ALICE.address(), rel1);
        anchor(ALICE.address(), rel2);

        PreconditionFailedException notRevoked = assertThrows(PreconditionFailedException.class,
                () -> ledger.releases.supersedeRelease(ALICE.address(), rel1, rel2, ALICE.address()));
        assertEquals("old release must be revoked", notRevoked.getReason());

        ledger.releases.revokeRelease(ALICE.address(), rel1, ALICE.address());
        Release old = ledger.releases.supersedeRelease(ALICE.address(), rel1, rel2, ALICE.address());
        assertEquals(rel2, old.getSupersededBy());
        assertNull(ledger.releases.getReleaseById(rel2).getSupersededBy());

        PreconditionFailedException again = assertThrows(PreconditionFailedException.class,
                () -> ledger.releases.supersedeRelease(ALICE.address(), rel1, rel2, ALICE.address()));
        assertEquals("already superseded", again.getReason());
    }

    @Test
    public void supersede_rejects_self_and_revoked_replacement() {
        anchor(ALICE.address(), rel1);
        anchor(ALICE.address(), rel2);
        ledger.releases.revokeRelease(ALICE.address(), rel1, ALICE.address());
        ledger.releases.revokeRelease(ALICE.address(), rel2, ALICE.address());

        InvalidInputException self = assertThrows(InvalidInputException.class,
                () -> ledger.releases.supersedeRelease(ALICE.address(), rel1, rel1, ALICE.address()));
        assertEquals("same release", self.getReason());

        PreconditionFailedException revoked = assertThrows(PreconditionFailedException.class,
                () -> ledger.releases.supersedeRelease(ALICE.address(), rel1, rel2, ALICE.address()));
        assertEquals("new release revoked", revoked.getReason());
    }

    @Test
    public void supersede_across_projects_is_rejected() {
        anchor(ALICE.address(), rel1);
        ledger.releases.anchorRelease(ALICE.address(), Hex32.id("project-2"), rel2, ctx, "ipfs://release", "v1",
                ALICE.address(), BOB.address(), Collections.singletonList(new SnapshotRef(repo, root)));
        ledger.releases.revokeRelease(ALICE.address(), rel1, ALICE.address());

        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> ledger.releases.supersedeRelease(ALICE.address(), rel1, rel2, ALICE.address()));
        assertEquals("project mismatch", e.getReason());
    }

    @Test
    public void project_views_page_in_anchor_order() {
        anchor(ALICE.address(), rel1);
        anchor(ALICE.address(), rel2);

        assertEquals(rel1, ledger.releases.getReleaseByIndex(project, 0).getId());
        assertEquals(rel2, ledger.releases.getReleaseByIndex(project, 1).getId());
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> ledger.releases.getReleaseByIndex(project, 2));
        assertEquals("invalid index", e.getReason());

        List<Release> page = ledger.releases.listReleases(project, 1, 10);
        assertEquals(1, page.size());
        assertEquals(rel2, page.get(0).getId());
        assertThrows(NotFoundException.class, () -> ledger.releases.getReleaseById(Hex32.id("missing")));
    }

    @Test
    public void release_events_follow_state_changes_in_order() {
        long before = ledger.journal.listAfter(null, 200).size();
        anchor(ALICE.address(), rel1);
        ledger.releases.reject(BOB.address(), rel1);
        ledger.releases.revokeRelease(ALICE.address(), rel1, ALICE.address());

        List<LedgerEvent> events = ledger.journal.listAfter(before, 200);
        assertEquals(3, events.size());
        assertEquals(LedgerEventType.RELEASE_ANCHORED, events.get(0).getType());
        assertEquals(LedgerEventType.GOVERNANCE_STATUS_CHANGED, events.get(1).getType());
        assertEquals(LedgerEventType.RELEASE_REVOKED, events.get(2).getType());
        assertTrue(events.get(0).getSeq() < events.get(1).getSeq());
    }

    @Test
    public void failed_membership_check_does_not_touch_repository() {
        WorkspaceMembership membership = mock(WorkspaceMembership.class);
        SnapshotLookup lookup = mock(SnapshotLookup.class);
        ReleaseRepository repository = mock(ReleaseRepository.class);
        when(repository.findById(anyString())).thenReturn(java.util.Optional.empty());
        when(membership.isMember(anyString(), eq(ALICE.address()))).thenReturn(true);
        when(membership.isMember(anyString(), eq(BOB.address()))).thenReturn(false);

        ReleaseRegistry registry = new ReleaseRegistry(repository, membership, lookup, ledger.delegation,
                new EventRecorder(new InMemoryEventJournal(), new ObjectMapper()), new SerialLedgerExecutor(),
                ledger.clock, new NoopLedgerMetrics());

        assertThrows(PreconditionFailedException.class, () -> registry.anchorRelease(ALICE.address(), project, rel1,
                ctx, "ipfs://release", "v1", ALICE.address(), BOB.address(),
                Collections.singletonList(new SnapshotRef(repo, root))));
        verify(lookup, never()).exists(anyString(), anyString());
        verify(repository, never()).insert(any(Release.class));
    }

    @Test
    public void fenced_governance_write_rejected_rolls_back_step() {
        ReleaseRepository repository = mock(ReleaseRepository.class);
        LedgerMetrics metrics = mock(LedgerMetrics.class);
        InMemoryEventJournal journal = new InMemoryEventJournal();
        Release stored = new Release(rel1, project, ctx, "ipfs://release", "v1", ALICE.address(), BOB.address(), T0);
        when(repository.findById(rel1)).thenReturn(Optional.of(stored));
        when(repository.compareAndUpdate(any(Release.class), any(Release.class))).thenReturn(false);

        ReleaseRegistry registry = new ReleaseRegistry(repository, mock(WorkspaceMembership.class),
                mock(SnapshotLookup.class), ledger.delegation,
                new EventRecorder(journal, new ObjectMapper()), new SerialLedgerExecutor(), ledger.clock, metrics);

        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> registry.reject(BOB.address(), rel1));
        assertEquals("concurrent update", e.getReason());
        verify(repository).compareAndUpdate(
                argThat(r -> r.getStatus() == ReleaseStatus.PENDING),
                argThat(r -> r.getStatus() == ReleaseStatus.REJECTED));
        verify(metrics).fencedWriteRejected("setGovernanceStatus");
        verify(metrics, never()).stateCommitted(anyString());
        assertTrue(journal.listAfter(null, 10).isEmpty());
    }

    @Test
    public void fenced_revoke_write_rejected_emits_no_event() {
        ReleaseRepository repository = mock(ReleaseRepository.class);
        LedgerMetrics metrics = mock(LedgerMetrics.class);
        InMemoryEventJournal journal = new InMemoryEventJournal();
        Release stored = new Release(rel1, project, ctx, "ipfs://release", "v1", ALICE.address(), BOB.address(), T0);
        when(repository.findById(rel1)).thenReturn(Optional.of(stored));

        ReleaseRegistry registry = new ReleaseRegistry(repository, mock(WorkspaceMembership.class),
                mock(SnapshotLookup.class), ledger.delegation,
                new EventRecorder(journal, new ObjectMapper()), new SerialLedgerExecutor(), ledger.clock, metrics);

        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> registry.revokeRelease(ALICE.address(), rel1, ALICE.address()));
        assertEquals("concurrent update", e.getReason());
        verify(metrics).fencedWriteRejected("revokeRelease");
        assertTrue(journal.listAfter(null, 10).isEmpty());
    }
}
