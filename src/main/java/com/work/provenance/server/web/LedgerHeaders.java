package com.work.provenance.server.web;

/**
 * 由宿主传输层认证后写入的调用方身份头。
 */
public final class LedgerHeaders {

    public static final String ACTING_IDENTITY = "X-Acting-Identity";

    private LedgerHeaders() {
    }
}
