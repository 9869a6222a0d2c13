package com.work.provenance.core.model;

/**
 * 治理状态，只能从 PENDING 迁移一次到终态，不可回退。
 * code 与链上枚举序号一致。
 */
public enum ReleaseStatus {
    PENDING(0),
    ACCEPTED(1),
    REJECTED(2);

    private final int code;

    ReleaseStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public static ReleaseStatus fromCode(int code) {
        for (ReleaseStatus s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new IllegalArgumentException("未知的 release status: " + code);
    }
}
