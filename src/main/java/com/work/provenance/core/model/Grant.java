package com.work.provenance.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * principal 在某个 context 内授予 relayer 的能力集合，键为 (principal, relayer, context)。
 *
 * 注意：
 * 1. 撤销不会删除记录，而是把 scopeMask 与 expiry 置零（逻辑作废）
 * 2. expiry == 0 表示“不存在有效授权”
 */
public class Grant {

    private final String principal;
    private final String relayer;
    private final String context;
    private final BigInteger scopeMask;
    private final long expiry;

    public Grant(String principal, String relayer, String context, BigInteger scopeMask, long expiry) {
        if (principal == null || relayer == null || context == null) {
            throw new IllegalArgumentException("principal/relayer/context 不能为null");
        }
        if (scopeMask == null || scopeMask.signum() < 0) {
            throw new IllegalArgumentException("scopeMask 不能为null或负数");
        }
        if (expiry < 0) {
            throw new IllegalArgumentException("expiry 不能为负数");
        }
        this.principal = principal;
        this.relayer = relayer;
        this.context = context;
        this.scopeMask = scopeMask;
        this.expiry = expiry;
    }

    public static Grant voided(String principal, String relayer, String context) {
        return new Grant(principal, relayer, context, BigInteger.ZERO, 0L);
    }

    public String getPrincipal() {
        return principal;
    }

    public String getRelayer() {
        return relayer;
    }

    public String getContext() {
        return context;
    }

    public BigInteger getScopeMask() {
        return scopeMask;
    }

    public long getExpiry() {
        return expiry;
    }

    public boolean isVoid() {
        return expiry == 0L;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Grant grant = (Grant) o;
        return expiry == grant.expiry
                && principal.equals(grant.principal)
                && relayer.equals(grant.relayer)
                && context.equals(grant.context)
                && scopeMask.equals(grant.scopeMask);
    }

    @Override
    public int hashCode() {
        return Objects.hash(principal, relayer, context, scopeMask, expiry);
    }

    @Override
    public String toString() {
        return "Grant{" +
                "principal='" + principal + '\'' +
                ", relayer='" + relayer + '\'' +
                ", context='" + context + '\'' +
                ", scopeMask=" + scopeMask.toString(16) +
                ", expiry=" + expiry +
                '}';
    }
}
