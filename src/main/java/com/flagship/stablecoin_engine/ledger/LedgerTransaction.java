package com.flagship.stablecoin_engine.ledger;

import com.flagship.stablecoin_engine.event.EngineEvent;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Unit of work for one mutating engine operation.
 *
 * Writes land in a private overlay on top of the snapshot the transaction
 * started from, so solvency checks inside the operation see its own effects
 * while other readers still see the committed snapshot. Events are buffered
 * until commit. External transfers that already happened register a
 * compensation which runs, newest first, if the operation fails.
 */
@Slf4j
public class LedgerTransaction implements LedgerView {

    private final UUID id = UUID.randomUUID();
    private final String operation;
    private final LedgerSnapshot base;
    private final Thread owner;

    private final Map<CollateralKey, BigInteger> collateralWrites = new HashMap<>();
    private final Map<String, BigInteger> debtWrites = new HashMap<>();
    private final List<EngineEvent> events = new ArrayList<>();
    private final Deque<Compensation> compensations = new ArrayDeque<>();

    LedgerTransaction(String operation, LedgerSnapshot base, Thread owner) {
        this.operation = operation;
        this.base = base;
        this.owner = owner;
    }

    public UUID getId() {
        return id;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public BigInteger collateralOf(String account, String assetId) {
        BigInteger written = collateralWrites.get(new CollateralKey(account, assetId));
        return written != null ? written : base.collateralOf(account, assetId);
    }

    @Override
    public BigInteger debtOf(String account) {
        BigInteger written = debtWrites.get(account);
        return written != null ? written : base.debtOf(account);
    }

    void putCollateral(String account, String assetId, BigInteger balance) {
        collateralWrites.put(new CollateralKey(account, assetId), balance);
    }

    void putDebt(String account, BigInteger balance) {
        debtWrites.put(account, balance);
    }

    public void record(EngineEvent event) {
        events.add(event);
    }

    public List<EngineEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Registers an action that undoes an external effect if the operation fails.
     * The action reports false when the undo itself did not happen.
     */
    public void onRollback(String description, BooleanSupplier action) {
        compensations.push(new Compensation(description, action));
    }

    boolean isOwnedBy(Thread thread) {
        return owner == thread;
    }

    LedgerSnapshot applyTo(LedgerSnapshot committed) {
        if (committed != base) {
            throw new IllegalStateException("Ledger snapshot changed underneath transaction " + id);
        }
        return base.apply(collateralWrites, debtWrites);
    }

    /**
     * Runs registered compensations newest first. Failures are logged and
     * attached to {@code failure} as suppressed exceptions.
     */
    void compensate(Throwable failure) {
        while (!compensations.isEmpty()) {
            Compensation compensation = compensations.pop();
            try {
                if (!compensation.getAction().getAsBoolean()) {
                    throw new IllegalStateException("Compensation reported failure: " + compensation.getDescription());
                }
                log.debug("Compensated external effect: tx={}, operation={}, action={}",
                    id, operation, compensation.getDescription());
            } catch (RuntimeException e) {
                log.error("Compensation failed: tx={}, operation={}, action={}, error={}",
                    id, operation, compensation.getDescription(), e.getMessage());
                failure.addSuppressed(e);
            }
        }
    }

    @Value
    private static class Compensation {
        String description;
        BooleanSupplier action;
    }
}
