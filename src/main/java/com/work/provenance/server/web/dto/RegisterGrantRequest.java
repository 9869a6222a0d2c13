package com.work.provenance.server.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * 通过 principal 的离线签名注册授权。scopes 为十进制或 0x 十六进制的 uint256。
 */
public class RegisterGrantRequest {

    @NotBlank(message = "principal 不能为空")
    private String principal;

    @NotBlank(message = "relayer 不能为空")
    private String relayer;

    @NotBlank(message = "context 不能为空")
    private String context;

    @NotBlank(message = "scopes 不能为空")
    private String scopes;

    @NotNull(message = "expiry 不能为空")
    private Long expiry;

    @NotNull(message = "deadline 不能为空")
    private Long deadline;

    @NotBlank(message = "signature 不能为空")
    private String signature;

    public String getPrincipal() {
        return principal;
    }

    public void setPrincipal(String principal) {
        this.principal = principal;
    }

    public String getRelayer() {
        return relayer;
    }

    public void setRelayer(String relayer) {
        this.relayer = relayer;
    }

    public String getContext() {
        return context;
    }

    public void setContext(String context) {
        this.context = context;
    }

    public String getScopes() {
        return scopes;
    }

    public void setScopes(String scopes) {
        this.scopes = scopes;
    }

    public Long getExpiry() {
        return expiry;
    }

    public void setExpiry(Long expiry) {
        this.expiry = expiry;
    }

    public Long getDeadline() {
        return deadline;
    }

    public void setDeadline(Long deadline) {
        this.deadline = deadline;
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }
}
