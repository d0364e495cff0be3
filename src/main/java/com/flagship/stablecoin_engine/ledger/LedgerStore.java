package com.flagship.stablecoin_engine.ledger;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the collateral and debt ledger state.
 *
 * Holds the latest committed {@link LedgerSnapshot} and at most one in-flight
 * {@link LedgerTransaction}. Callers serialize mutations through the engine's
 * reentrancy guard; this class only checks that the rules are followed.
 */
@Slf4j
public class LedgerStore {

    private final AtomicReference<LedgerSnapshot> committed = new AtomicReference<>(LedgerSnapshot.EMPTY);
    private volatile LedgerTransaction active;

    public LedgerTransaction begin(String operation) {
        if (active != null) {
            throw new IllegalStateException(
                "Transaction " + active.getId() + " (" + active.getOperation() + ") is already in flight");
        }
        LedgerTransaction tx = new LedgerTransaction(operation, committed.get(), Thread.currentThread());
        active = tx;
        return tx;
    }

    public LedgerSnapshot commit(LedgerTransaction tx) {
        requireActive(tx);
        try {
            LedgerSnapshot next = tx.applyTo(committed.get());
            committed.set(next);
            return next;
        } finally {
            active = null;
        }
    }

    /**
     * Discards the transaction's writes and events and runs its compensations.
     */
    public void rollback(LedgerTransaction tx, Throwable cause) {
        requireActive(tx);
        active = null;
        tx.compensate(cause);
        log.debug("Rolled back transaction {} ({})", tx.getId(), tx.getOperation());
    }

    /**
     * The view the calling thread should read: its own in-flight transaction
     * if it has one, otherwise the latest committed snapshot.
     */
    public LedgerView view() {
        LedgerTransaction tx = active;
        if (tx != null && tx.isOwnedBy(Thread.currentThread())) {
            return tx;
        }
        return committed.get();
    }

    public LedgerSnapshot snapshot() {
        return committed.get();
    }

    /**
     * @throws IllegalStateException if the calling thread has no transaction in flight
     */
    public LedgerTransaction currentTransaction() {
        LedgerTransaction tx = active;
        if (tx == null || !tx.isOwnedBy(Thread.currentThread())) {
            throw new IllegalStateException("Ledger mutation attempted outside of a transaction");
        }
        return tx;
    }

    private void requireActive(LedgerTransaction tx) {
        if (active != tx) {
            throw new IllegalStateException("Transaction " + tx.getId() + " is not the active transaction");
        }
    }
}
