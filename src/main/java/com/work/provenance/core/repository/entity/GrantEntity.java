package com.work.provenance.core.repository.entity;

import com.baomidou.mybatisplus.annotation.TableName;

import java.math.BigDecimal;

/**
 * 授权表实体类，主键为 (principal, relayer, context_id)。
 */
@TableName("ledger_grant")
public class GrantEntity {

    private String principal;

    private String relayer;

    private String contextId;

    private BigDecimal scopeMask;

    private Long expiry;

    private Long updatedAt;

    public GrantEntity() {
    }

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

    public String getContextId() {
        return contextId;
    }

    public void setContextId(String contextId) {
        this.contextId = contextId;
    }

    public BigDecimal getScopeMask() {
        return scopeMask;
    }

    public void setScopeMask(BigDecimal scopeMask) {
        this.scopeMask = scopeMask;
    }

    public Long getExpiry() {
        return expiry;
    }

    public void setExpiry(Long expiry) {
        this.expiry = expiry;
    }

    public Long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Long updatedAt) {
        this.updatedAt = updatedAt;
    }
}
