package com.work.provenance.server.web;

import com.work.provenance.core.model.Snapshot;
import com.work.provenance.core.service.SnapshotRegistry;
import com.work.provenance.server.web.dto.CountView;
import com.work.provenance.server.web.dto.CreateSnapshotRequest;
import com.work.provenance.server.web.dto.SnapshotView;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/snapshots")
public class SnapshotController {

    private final SnapshotRegistry snapshotRegistry;

    public SnapshotController(SnapshotRegistry snapshotRegistry) {
        this.snapshotRegistry = snapshotRegistry;
    }

    @PostMapping
    public ResponseEntity<SnapshotView> create(@RequestHeader(LedgerHeaders.ACTING_IDENTITY) String acting,
                                               @Validated @RequestBody CreateSnapshotRequest req) {
        Snapshot s = snapshotRegistry.createSnapshot(acting, req.getRepo(), req.getContext(), req.getCommitHash(),
                req.getMerkleRoot(), req.getManifestRef(), req.getAuthor());
        return ResponseEntity.ok(toView(s));
    }

    @GetMapping("/exists")
    public ResponseEntity<Map<String, Boolean>> exists(@RequestParam("repo") String repo,
                                                       @RequestParam("root") String root) {
        return ResponseEntity.ok(Collections.singletonMap("exists", snapshotRegistry.exists(repo, root)));
    }

    @GetMapping("/{repo}/count")
    public ResponseEntity<CountView> count(@PathVariable String repo) {
        CountView v = new CountView();
        v.setKey(repo);
        v.setCount(snapshotRegistry.getSnapshotsCount(repo));
        return ResponseEntity.ok(v);
    }

    @GetMapping("/{repo}/{index}")
    public ResponseEntity<SnapshotView> get(@PathVariable String repo, @PathVariable long index) {
        return ResponseEntity.ok(toView(snapshotRegistry.getSnapshot(repo, index)));
    }

    private static SnapshotView toView(Snapshot s) {
        SnapshotView v = new SnapshotView();
        v.setRepo(s.getRepoRef());
        v.setIndex(s.getIndex());
        v.setContext(s.getContext());
        v.setAuthor(s.getAuthor());
        v.setCommitHash(s.getCommitHash());
        v.setMerkleRoot(s.getMerkleRoot());
        v.setManifestRef(s.getManifestRef());
        v.setCreatedAt(s.getCreatedAt());
        return v;
    }
}
