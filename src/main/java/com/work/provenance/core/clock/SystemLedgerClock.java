package com.work.provenance.core.clock;

import java.time.Clock;

/**
 * 以本地系统时钟作为账本时间，适合单节点部署和测试环境。
 */
public class SystemLedgerClock implements LedgerClock {

    private final Clock clock;

    public SystemLedgerClock() {
        this(Clock.systemUTC());
    }

    public SystemLedgerClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long now() {
        return clock.instant().getEpochSecond();
    }
}
