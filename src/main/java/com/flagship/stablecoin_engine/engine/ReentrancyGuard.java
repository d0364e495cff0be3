package com.flagship.stablecoin_engine.engine;

import com.flagship.stablecoin_engine.exception.ReentrantCallException;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Global mutual-exclusion guard for mutating entry points.
 *
 * Other threads wait for the guard; the thread that already holds it is
 * rejected, because a nested call would observe ledger and custody out of step.
 */
public class ReentrancyGuard {

    private final ReentrantLock lock = new ReentrantLock();

    public <T> T runExclusive(String operation, Supplier<T> body) {
        if (lock.isHeldByCurrentThread()) {
            throw new ReentrantCallException(operation);
        }
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked() {
        return lock.isLocked();
    }
}
