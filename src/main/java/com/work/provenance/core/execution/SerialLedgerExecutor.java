package com.work.provenance.core.execution;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static com.work.provenance.core.support.ValidationUtils.requireNonEmpty;
import static com.work.provenance.core.support.ValidationUtils.requireNonNull;

/**
 * 单进程单写者：一把公平锁串行化全部写操作。
 * 内存存储下，各服务保证“先校验后写入”，因此失败的步骤不会留下部分状态。
 */
public class SerialLedgerExecutor implements LedgerExecutor {

    private final ReentrantLock writeLock = new ReentrantLock(true);

    @Override
    public <T> T execute(String operation, Supplier<T> work) {
        requireNonEmpty(operation, "operation");
        requireNonNull(work, "work");
        writeLock.lock();
        try {
            return work.get();
        } finally {
            writeLock.unlock();
        }
    }
}
