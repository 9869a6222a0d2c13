package com.work.provenance.server.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * 由 relayer 提交当前 authority 对新 authority 的签名。
 */
public class SetAuthorityRequest {

    @NotBlank(message = "authority 不能为空")
    private String authority;

    @NotNull(message = "deadline 不能为空")
    private Long deadline;

    @NotBlank(message = "signature 不能为空")
    private String signature;

    public String getAuthority() {
        return authority;
    }

    public void setAuthority(String authority) {
        this.authority = authority;
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
