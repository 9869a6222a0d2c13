package com.work.provenance.server.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * 由 relayer 提交 authority 对成员变更的签名。
 */
public class SetMemberRequest {

    @NotBlank(message = "member 不能为空")
    private String member;

    @NotNull(message = "isMember 不能为空")
    private Boolean isMember;

    @NotNull(message = "deadline 不能为空")
    private Long deadline;

    @NotBlank(message = "signature 不能为空")
    private String signature;

    public String getMember() {
        return member;
    }

    public void setMember(String member) {
        this.member = member;
    }

    public Boolean getIsMember() {
        return isMember;
    }

    public void setIsMember(Boolean isMember) {
        this.isMember = isMember;
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
