package com.work.provenance.core.repository.entity;

import com.baomidou.mybatisplus.annotation.TableName;

/**
 * 签名 nonce 计数器表实体类，主键为 (registry, principal)。
 */
@TableName("ledger_nonce")
public class NonceCounterEntity {

    private String registry;

    private String principal;

    private Long nonce;

    private Long updatedAt;

    public NonceCounterEntity() {
    }

    public String getRegistry() {
        return registry;
    }

    public void setRegistry(String registry) {
        this.registry = registry;
    }

    public String getPrincipal() {
        return principal;
    }

    public void setPrincipal(String principal) {
        this.principal = principal;
    }

    public Long getNonce() {
        return nonce;
    }

    public void setNonce(Long nonce) {
        this.nonce = nonce;
    }

    public Long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Long updatedAt) {
        this.updatedAt = updatedAt;
    }
}
