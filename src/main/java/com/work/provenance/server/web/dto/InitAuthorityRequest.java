package com.work.provenance.server.web.dto;

import javax.validation.constraints.NotBlank;

public class InitAuthorityRequest {

    @NotBlank(message = "authority 不能为空")
    private String authority;

    public String getAuthority() {
        return authority;
    }

    public void setAuthority(String authority) {
        this.authority = authority;
    }
}
