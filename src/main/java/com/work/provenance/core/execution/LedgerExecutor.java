package com.work.provenance.core.execution;

import java.util.function.Supplier;

import static com.work.provenance.core.support.ValidationUtils.requireNonNull;

/**
 * 统一的“账本步骤”执行入口。
 *
 * 约束：
 * - 所有写操作串行执行，彼此之间全序，且要么整体提交要么整体失败
 * - 只读查询不经过执行器，不阻塞
 * - 执行器内部不做任何重试，失败直接抛给调用方
 */
public interface LedgerExecutor {

    <T> T execute(String operation, Supplier<T> work);

    default void execute(String operation, Runnable work) {
        requireNonNull(work, "work");
        execute(operation, () -> {
            work.run();
            return null;
        });
    }
}
