package com.work.provenance.core.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口，业务/平台可通过自定义 Bean 接入具体实现。
 */
public interface LedgerMetrics {

    default void signatureRejected(String op, String reason) {
    }

    default void authorizationDenied(String op) {
    }

    default void stateCommitted(String op) {
    }

    /**
     * 带围栏条件的写入影响 0 行（其他节点已先行修改）。
     */
    default void fencedWriteRejected(String op) {
    }
}
