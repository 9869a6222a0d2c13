package com.work.provenance.server.web;

import com.work.provenance.core.service.WorkspaceRegistry;
import com.work.provenance.server.web.dto.InitAuthorityRequest;
import com.work.provenance.server.web.dto.MembershipView;
import com.work.provenance.server.web.dto.SetAuthorityRequest;
import com.work.provenance.server.web.dto.SetMemberRequest;
import com.work.provenance.server.web.dto.WorkspaceView;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * workspace authority 与成员管理接口。
 */
@RestController
@RequestMapping("/api/v1/workspaces")
public class WorkspaceController {

    private final WorkspaceRegistry workspaceRegistry;

    public WorkspaceController(WorkspaceRegistry workspaceRegistry) {
        this.workspaceRegistry = workspaceRegistry;
    }

    @PostMapping("/{context}/authority")
    public ResponseEntity<WorkspaceView> initAuthority(@PathVariable String context,
                                                       @Validated @RequestBody InitAuthorityRequest req) {
        workspaceRegistry.initAuthority(context, req.getAuthority());
        return ResponseEntity.ok(view(context));
    }

    @PostMapping("/{context}/authority-with-sig")
    public ResponseEntity<WorkspaceView> setAuthority(@PathVariable String context,
                                                      @Validated @RequestBody SetAuthorityRequest req) {
        workspaceRegistry.setAuthorityWithSig(context, req.getAuthority(), req.getDeadline(), req.getSignature());
        return ResponseEntity.ok(view(context));
    }

    @PostMapping("/{context}/members-with-sig")
    public ResponseEntity<MembershipView> setMember(@PathVariable String context,
                                                    @Validated @RequestBody SetMemberRequest req) {
        workspaceRegistry.setMemberWithSig(context, req.getMember(), req.getIsMember(),
                req.getDeadline(), req.getSignature());
        return ResponseEntity.ok(membership(context, req.getMember()));
    }

    @PostMapping("/{context}/leave")
    public ResponseEntity<MembershipView> leave(@RequestHeader(LedgerHeaders.ACTING_IDENTITY) String acting,
                                                @PathVariable String context) {
        workspaceRegistry.leave(acting, context);
        return ResponseEntity.ok(membership(context, acting));
    }

    @GetMapping("/{context}/members/{identity}")
    public ResponseEntity<MembershipView> isMember(@PathVariable String context, @PathVariable String identity) {
        return ResponseEntity.ok(membership(context, identity));
    }

    @GetMapping("/{context}/authority")
    public ResponseEntity<WorkspaceView> authority(@PathVariable String context) {
        if (!workspaceRegistry.authorityOf(context).isPresent()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(view(context));
    }

    private WorkspaceView view(String context) {
        WorkspaceView v = new WorkspaceView();
        v.setContext(context);
        workspaceRegistry.authorityOf(context).ifPresent(a -> {
            v.setAuthority(a);
            v.setNonce(workspaceRegistry.nonceOf(a));
        });
        return v;
    }

    private MembershipView membership(String context, String identity) {
        MembershipView v = new MembershipView();
        v.setContext(context);
        v.setIdentity(identity);
        v.setMember(workspaceRegistry.isMember(context, identity));
        return v;
    }
}
