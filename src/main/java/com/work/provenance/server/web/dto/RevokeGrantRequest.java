package com.work.provenance.server.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * principal 本人撤销授权，principal 取自 X-Acting-Identity。
 */
public class RevokeGrantRequest {

    @NotBlank(message = "relayer 不能为空")
    private String relayer;

    @NotBlank(message = "context 不能为空")
    private String context;

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
}
