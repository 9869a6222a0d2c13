package com.work.provenance.server.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

public class RevokeGrantWithSigRequest {

    @NotBlank(message = "principal 不能为空")
    private String principal;

    @NotBlank(message = "relayer 不能为空")
    private String relayer;

    @NotBlank(message = "context 不能为空")
    private String context;

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
