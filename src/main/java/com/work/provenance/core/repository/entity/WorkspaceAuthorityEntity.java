package com.work.provenance.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

/**
 * workspace authority 表实体类。
 */
@TableName("workspace_authority")
public class WorkspaceAuthorityEntity {

    @TableId(value = "context_id", type = IdType.INPUT)
    private String contextId;

    private String authority;

    private Long updatedAt;

    public WorkspaceAuthorityEntity() {
    }

    public String getContextId() {
        return contextId;
    }

    public void setContextId(String contextId) {
        this.contextId = contextId;
    }

    public String getAuthority() {
        return authority;
    }

    public void setAuthority(String authority) {
        this.authority = authority;
    }

    public Long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Long updatedAt) {
        this.updatedAt = updatedAt;
    }
}
