package com.work.provenance.core.repository.entity;

import com.baomidou.mybatisplus.annotation.TableName;

/**
 * workspace 成员表实体类，主键为 (context_id, member)。
 */
@TableName("workspace_member")
public class WorkspaceMemberEntity {

    private String contextId;

    private String member;

    private Boolean active;

    private Long updatedAt;

    public WorkspaceMemberEntity() {
    }

    public String getContextId() {
        return contextId;
    }

    public void setContextId(String contextId) {
        this.contextId = contextId;
    }

    public String getMember() {
        return member;
    }

    public void setMember(String member) {
        this.member = member;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }

    public Long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Long updatedAt) {
        this.updatedAt = updatedAt;
    }
}
