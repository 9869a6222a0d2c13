package com.work.provenance.server.web;

import com.work.provenance.core.exception.InvalidInputException;
import com.work.provenance.core.model.Release;
import com.work.provenance.core.model.ReleaseStatus;
import com.work.provenance.core.model.SnapshotRef;
import com.work.provenance.core.service.ReleaseRegistry;
import com.work.provenance.server.web.dto.AnchorReleaseRequest;
import com.work.provenance.server.web.dto.CountView;
import com.work.provenance.server.web.dto.DaoExecutorRequest;
import com.work.provenance.server.web.dto.ReleaseView;
import com.work.provenance.server.web.dto.RevokeReleaseRequest;
import com.work.provenance.server.web.dto.SetStatusRequest;
import com.work.provenance.server.web.dto.SnapshotRefRequest;
import com.work.provenance.server.web.dto.SupersedeReleaseRequest;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * release 锚定、治理裁决、撤销与替代接口。
 */
@RestController
@RequestMapping("/api/v1/releases")
public class ReleaseController {

    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 200;

    private final ReleaseRegistry releaseRegistry;

    public ReleaseController(ReleaseRegistry releaseRegistry) {
        this.releaseRegistry = releaseRegistry;
    }

    @PostMapping
    public ResponseEntity<ReleaseView> anchor(@RequestHeader(LedgerHeaders.ACTING_IDENTITY) String acting,
                                              @Validated @RequestBody AnchorReleaseRequest req) {
        List<SnapshotRef> refs = new ArrayList<>(req.getSnapshots().size());
        for (SnapshotRefRequest r : req.getSnapshots()) {
            refs.add(new SnapshotRef(r.getRepo(), r.getRoot()));
        }
        Release release = releaseRegistry.anchorRelease(acting, req.getProjectId(), req.getId(), req.getContext(),
                req.getManifestRef(), req.getName(), req.getAuthor(), req.getGovernanceAuthority(), refs);
        return ResponseEntity.ok(toView(release));
    }

    @PostMapping("/{id}/status")
    public ResponseEntity<ReleaseView> setStatus(@RequestHeader(LedgerHeaders.ACTING_IDENTITY) String acting,
                                                 @PathVariable String id,
                                                 @Validated @RequestBody SetStatusRequest req) {
        ReleaseStatus status;
        try {
            status = ReleaseStatus.valueOf(req.getStatus().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("bad status", "未知的 release status: " + req.getStatus(), e);
        }
        return ResponseEntity.ok(toView(releaseRegistry.setGovernanceStatus(acting, id, status)));
    }

    @PostMapping("/{id}/revoke")
    public ResponseEntity<ReleaseView> revoke(@RequestHeader(LedgerHeaders.ACTING_IDENTITY) String acting,
                                              @PathVariable String id,
                                              @Validated @RequestBody RevokeReleaseRequest req) {
        return ResponseEntity.ok(toView(releaseRegistry.revokeRelease(acting, id, req.getAuthor())));
    }

    @PostMapping("/{id}/supersede")
    public ResponseEntity<ReleaseView> supersede(@RequestHeader(LedgerHeaders.ACTING_IDENTITY) String acting,
                                                 @PathVariable String id,
                                                 @Validated @RequestBody SupersedeReleaseRequest req) {
        return ResponseEntity.ok(toView(releaseRegistry.supersedeRelease(acting, id, req.getNewId(), req.getAuthor())));
    }

    @PostMapping("/dao-executors")
    public ResponseEntity<Void> setDaoExecutor(@RequestHeader(LedgerHeaders.ACTING_IDENTITY) String acting,
                                               @Validated @RequestBody DaoExecutorRequest req) {
        releaseRegistry.setDaoExecutor(acting, req.getContext(), req.getAuthor(), req.getExecutor());
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{id}")
    public ResponseEntity<ReleaseView> get(@PathVariable String id) {
        return ResponseEntity.ok(toView(releaseRegistry.getReleaseById(id)));
    }

    @GetMapping("/projects/{projectId}")
    public ResponseEntity<List<ReleaseView>> list(@PathVariable String projectId,
                                                  @RequestParam(value = "offset", required = false) Long offset,
                                                  @RequestParam(value = "limit", required = false) Integer limit) {
        long o = offset == null ? 0L : Math.max(0L, offset);
        int l = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(MAX_LIMIT, limit));
        List<Release> rows = releaseRegistry.listReleases(projectId, o, l);
        List<ReleaseView> out = new ArrayList<>(rows.size());
        for (Release r : rows) {
            out.add(toView(r));
        }
        return ResponseEntity.ok(out);
    }

    @GetMapping("/projects/{projectId}/count")
    public ResponseEntity<CountView> count(@PathVariable String projectId) {
        CountView v = new CountView();
        v.setKey(projectId);
        v.setCount(releaseRegistry.getReleasesCount(projectId));
        return ResponseEntity.ok(v);
    }

    @GetMapping("/projects/{projectId}/{index}")
    public ResponseEntity<ReleaseView> byIndex(@PathVariable String projectId, @PathVariable long index) {
        return ResponseEntity.ok(toView(releaseRegistry.getReleaseByIndex(projectId, index)));
    }

    private static ReleaseView toView(Release r) {
        ReleaseView v = new ReleaseView();
        v.setId(r.getId());
        v.setProjectId(r.getProjectId());
        v.setContext(r.getContext());
        v.setManifestRef(r.getManifestRef());
        v.setName(r.getName());
        v.setAuthor(r.getAuthor());
        v.setGovernanceAuthority(r.getGovernanceAuthority());
        v.setCreatedAt(r.getCreatedAt());
        v.setStatus(r.getStatus().name());
        v.setRevoked(r.isRevoked());
        v.setSupersededBy(r.getSupersededBy());
        v.setStatusTimestamp(r.getStatusTimestamp());
        v.setStatusAuthor(r.getStatusAuthor());
        return v;
    }
}
