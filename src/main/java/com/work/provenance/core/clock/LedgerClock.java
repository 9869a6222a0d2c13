package com.work.provenance.core.clock;

/**
 * 账本时间端口：返回当前 unix 秒。
 * 授权过期、签名 deadline、记录时间戳都只从这里取时间。
 */
public interface LedgerClock {

    long now();
}
