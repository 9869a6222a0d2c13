package com.work.provenance.core.model;

import java.math.BigInteger;

/**
 * 能力位定义，位序号必须与已部署签名方保持一致。
 */
public enum Scope {
    CLAIM(0),
    SNAPSHOT(1),
    ATTEST(2),
    BACKUP(3),
    RELEASE(4);

    /**
     * 通配授权哨兵值：uint256 全 1。只有恰好等于该值才视为通配，不做超集判断。
     */
    public static final BigInteger ALL = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private final int bit;
    private final BigInteger mask;

    Scope(int bit) {
        this.bit = bit;
        this.mask = BigInteger.ONE.shiftLeft(bit);
    }

    public int getBit() {
        return bit;
    }

    public BigInteger mask() {
        return mask;
    }

    public static BigInteger maskOf(Scope... scopes) {
        BigInteger m = BigInteger.ZERO;
        for (Scope s : scopes) {
            m = m.or(s.mask);
        }
        return m;
    }
}
