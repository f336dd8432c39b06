package com.caltrack.backend.common.tx;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * ✅ Single-writer boundary for the live store:
 * - every mutation runs under one in-process lock
 * - the lock is held until the transaction has committed (or rolled back)
 *
 * Re-entrant: a write nested in another write joins the outer transaction.
 * Multi-process deployments would need a DB-level lock instead.
 */
@Component
public class StoreWriteGate {

    private final ReentrantLock lock = new ReentrantLock();
    private final TransactionTemplate tx;

    public StoreWriteGate(PlatformTransactionManager txManager) {
        this.tx = new TransactionTemplate(txManager);
    }

    public <T> T write(Supplier<T> work) {
        lock.lock();
        try {
            return tx.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable work) {
        write(() -> {
            work.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
