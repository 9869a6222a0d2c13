package com.work.provenance.core.service;

import com.work.provenance.core.crypto.DelegatePayload;
import com.work.provenance.core.exception.NotFoundException;
import com.work.provenance.core.exception.PreconditionFailedException;
import com.work.provenance.core.exception.UnauthorizedException;
import com.work.provenance.core.model.Scope;
import com.work.provenance.core.model.Snapshot;
import com.work.provenance.testing.Hex32;
import com.work.provenance.testing.LedgerFixture;
import com.work.provenance.testing.TestSigner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.work.provenance.testing.LedgerFixture.T0;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SnapshotRegistryTest {

    private static final TestSigner ALICE = TestSigner.ALICE;
    private static final TestSigner BOB = TestSigner.BOB;
    private static final TestSigner CAROL = TestSigner.CAROL;

    private final String ctx = Hex32.id("workspace");
    private final String repo = Hex32.id("repo");
    private final String commit = Hex32.id("commit-1");

    private LedgerFixture ledger;

    @BeforeEach
    public void setUp() {
        ledger = new LedgerFixture();
        ledger.workspace.initAuthority(ctx, ALICE.address());
    }

    private Snapshot create(String acting, String root) {
        return ledger.snapshots.createSnapshot(acting, repo, ctx, commit, root, "ipfs://manifest", ALICE.address());
    }

    @Test
    public void author_creates_indexed_snapshots() {
        Snapshot first = create(ALICE.address(), Hex32.id("root-1"));
        ledger.clock.advance(10);
        Snapshot second = create(ALICE.address(), Hex32.id("root-2"));

        assertEquals(0L, first.getIndex());
        assertEquals(1L, second.getIndex());
        assertEquals(2L, ledger.snapshots.getSnapshotsCount(repo));
        assertTrue(ledger.snapshots.exists(repo, Hex32.id("root-1")));
        assertEquals(T0 + 10, ledger.snapshots.getSnapshot(repo, 1).getCreatedAt());
        assertEquals(0L, ledger.snapshots.getSnapshotByRoot(repo, Hex32.id("root-1")).getIndex());
    }

    @Test
    public void duplicate_root_in_same_repo_is_rejected() {
        create(ALICE.address(), Hex32.id("root-1"));
        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> create(ALICE.address(), Hex32.id("root-1")));
        assertEquals("duplicate root", e.getReason());
    }

    @Test
    public void same_root_in_another_repo_is_allowed() {
        create(ALICE.address(), Hex32.id("root-1"));
        ledger.snapshots.createSnapshot(ALICE.address(), Hex32.id("repo-2"), ctx, commit, Hex32.id("root-1"),
                "ipfs://manifest", ALICE.address());
        assertFalse(ledger.snapshots.exists(Hex32.id("repo-3"), Hex32.id("root-1")));
        assertTrue(ledger.snapshots.exists(Hex32.id("repo-2"), Hex32.id("root-1")));
    }

    @Test
    public void relayer_needs_snapshot_scope() {
        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> create(BOB.address(), Hex32.id("root-1")));
        assertEquals("not authorized", e.getReason());

        long deadline = T0 + 600;
        DelegatePayload payload = new DelegatePayload(ALICE.address(), BOB.address(), ctx, Scope.SNAPSHOT.mask(),
                0L, T0 + 3600, deadline);
        ledger.delegation.registerGrant(ALICE.address(), BOB.address(), ctx, Scope.SNAPSHOT.mask(), T0 + 3600,
                deadline, ALICE.sign(ledger.config.getDelegationDomain(), payload));

        Snapshot s = create(BOB.address(), Hex32.id("root-1"));
        assertEquals(ALICE.address(), s.getAuthor());
    }

    @Test
    public void author_must_be_workspace_member() {
        PreconditionFailedException e = assertThrows(PreconditionFailedException.class,
                () -> ledger.snapshots.createSnapshot(CAROL.address(), repo, ctx, commit, Hex32.id("root-1"),
                        "ipfs://manifest", CAROL.address()));
        assertEquals("author not member", e.getReason());
    }

    @Test
    public void views_report_missing_snapshots() {
        NotFoundException byIndex = assertThrows(NotFoundException.class, () -> ledger.snapshots.getSnapshot(repo, 0));
        assertEquals("invalid index", byIndex.getReason());
        assertThrows(NotFoundException.class, () -> ledger.snapshots.getSnapshotByRoot(repo, Hex32.id("nope")));
        assertEquals(0L, ledger.snapshots.getSnapshotsCount(repo));
    }
}
