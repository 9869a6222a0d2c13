package com.work.provenance.server.web;

import com.work.provenance.core.model.Grant;
import com.work.provenance.core.model.Scope;
import com.work.provenance.core.service.DelegationEngine;
import com.work.provenance.server.web.dto.AuthorizationView;
import com.work.provenance.server.web.dto.GrantView;
import com.work.provenance.server.web.dto.NonceView;
import com.work.provenance.server.web.dto.RegisterGrantRequest;
import com.work.provenance.server.web.dto.RevokeGrantRequest;
import com.work.provenance.server.web.dto.RevokeGrantWithSigRequest;
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

import java.math.BigInteger;
import java.util.Locale;

import static com.work.provenance.core.support.ValidationUtils.parseUint256;

/**
 * 能力委托接口：注册、撤销、授权查询。
 */
@RestController
@RequestMapping("/api/v1/delegations")
public class DelegationController {

    private final DelegationEngine delegationEngine;

    public DelegationController(DelegationEngine delegationEngine) {
        this.delegationEngine = delegationEngine;
    }

    @PostMapping
    public ResponseEntity<GrantView> register(@Validated @RequestBody RegisterGrantRequest req) {
        Grant grant = delegationEngine.registerGrant(req.getPrincipal(), req.getRelayer(), req.getContext(),
                parseUint256(req.getScopes(), "scopes"), req.getExpiry(), req.getDeadline(), req.getSignature());
        return ResponseEntity.ok(toView(grant));
    }

    @PostMapping("/revoke")
    public ResponseEntity<Void> revoke(@RequestHeader(LedgerHeaders.ACTING_IDENTITY) String acting,
                                       @Validated @RequestBody RevokeGrantRequest req) {
        delegationEngine.revoke(acting, req.getRelayer(), req.getContext());
        return ResponseEntity.ok().build();
    }

    @PostMapping("/revoke-with-sig")
    public ResponseEntity<Void> revokeWithSig(@Validated @RequestBody RevokeGrantWithSigRequest req) {
        delegationEngine.revokeWithSig(req.getPrincipal(), req.getRelayer(), req.getContext(),
                req.getDeadline(), req.getSignature());
        return ResponseEntity.ok().build();
    }

    /**
     * capability 可以是能力名（如 RELEASE），也可以是 uint256 位掩码。
     */
    @GetMapping("/authorized")
    public ResponseEntity<AuthorizationView> authorized(@RequestParam("principal") String principal,
                                                        @RequestParam("relayer") String relayer,
                                                        @RequestParam("capability") String capability,
                                                        @RequestParam("context") String context) {
        BigInteger mask = parseCapability(capability);
        AuthorizationView v = new AuthorizationView();
        v.setPrincipal(principal);
        v.setRelayer(relayer);
        v.setContext(context);
        v.setCapability(capability);
        v.setAuthorized(delegationEngine.isAuthorized(principal, relayer, mask, context));
        return ResponseEntity.ok(v);
    }

    @GetMapping("/nonces/{principal}")
    public ResponseEntity<NonceView> nonce(@PathVariable String principal) {
        NonceView v = new NonceView();
        v.setPrincipal(principal);
        v.setRegistry(DelegationEngine.NONCE_REGISTRY);
        v.setNonce(delegationEngine.nonceOf(principal));
        return ResponseEntity.ok(v);
    }

    @GetMapping("/grant")
    public ResponseEntity<GrantView> grant(@RequestParam("principal") String principal,
                                           @RequestParam("relayer") String relayer,
                                           @RequestParam("context") String context) {
        return delegationEngine.getGrant(principal, relayer, context)
                .map(g -> ResponseEntity.ok(toView(g)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static BigInteger parseCapability(String capability) {
        String c = capability == null ? "" : capability.trim();
        for (Scope s : Scope.values()) {
            if (s.name().equals(c.toUpperCase(Locale.ROOT))) {
                return s.mask();
            }
        }
        if ("ALL".equals(c.toUpperCase(Locale.ROOT))) {
            return Scope.ALL;
        }
        return parseUint256(c, "capability");
    }

    private static GrantView toView(Grant g) {
        GrantView v = new GrantView();
        v.setPrincipal(g.getPrincipal());
        v.setRelayer(g.getRelayer());
        v.setContext(g.getContext());
        v.setScopes(g.getScopeMask().toString());
        v.setExpiry(g.getExpiry());
        v.setActive(!g.isVoid());
        return v;
    }
}
