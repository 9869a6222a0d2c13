package com.work.provenance.core.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static com.work.provenance.core.support.ValidationUtils.requireNonEmpty;
import static com.work.provenance.core.support.ValidationUtils.requireNonNull;

/**
 * Postgres 存储下的执行器：节点内串行 + 数据库事务。
 * <p>
 * 事务边界：一个账本步骤对应一个事务，任何异常都会回滚该步骤内的全部写入（包括事件日志）。
 * 节点内的锁不跨进程。多节点共用一个库时，读后写的步骤依赖存储层的围栏写入：
 * <ul>
 *     <li>nonce 以 CAS 推进，签名请求在多个节点上至多成功一次；</li>
 *     <li>release 的可变字段以 (status, revoked, supersededBy) 为条件更新，影响 0 行即回滚；</li>
 *     <li>workspace authority 首次写入用 ON CONFLICT DO NOTHING，轮换以旧 authority 为条件；</li>
 *     <li>release 与快照的插入冲突由主键及唯一约束拒绝，映射为 PRECONDITION_FAILED。</li>
 * </ul>
 * 授权、成员与 DAO executor 的写入是后写覆盖语义，不做围栏。
 */
public class TransactionalLedgerExecutor implements LedgerExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransactionalLedgerExecutor.class);

    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final TransactionTemplate txTemplate;

    public TransactionalLedgerExecutor(PlatformTransactionManager transactionManager, int timeoutSeconds) {
        requireNonNull(transactionManager, "transactionManager");
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setTimeout(timeoutSeconds);
        this.txTemplate = template;
    }

    @Override
    public <T> T execute(String operation, Supplier<T> work) {
        requireNonEmpty(operation, "operation");
        requireNonNull(work, "work");
        writeLock.lock();
        try {
            return txTemplate.execute(status -> work.get());
        } catch (RuntimeException e) {
            log.debug("ledger step rolled back op={} err={}", operation, e.getMessage());
            throw e;
        } finally {
            writeLock.unlock();
        }
    }
}
