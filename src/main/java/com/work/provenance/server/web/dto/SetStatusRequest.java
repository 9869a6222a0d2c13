package com.work.provenance.server.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * 目标状态：ACCEPTED 或 REJECTED。
 */
public class SetStatusRequest {

    @NotBlank(message = "status 不能为空")
    private String status;

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
