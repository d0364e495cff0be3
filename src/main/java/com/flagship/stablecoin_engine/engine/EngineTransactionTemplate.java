package com.flagship.stablecoin_engine.engine;

import com.flagship.stablecoin_engine.event.EngineEvent;
import com.flagship.stablecoin_engine.event.EngineEventPublisher;
import com.flagship.stablecoin_engine.exception.StablecoinEngineException;
import com.flagship.stablecoin_engine.ledger.LedgerStore;
import com.flagship.stablecoin_engine.ledger.LedgerTransaction;
import com.flagship.stablecoin_engine.observability.CorrelationContext;
import com.flagship.stablecoin_engine.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs a mutating operation all-or-nothing.
 *
 * Under the reentrancy guard: begin a ledger transaction, run the body,
 * commit on success; on any throwable roll back (discarding writes and
 * events, compensating external transfers) and rethrow unchanged. Events are
 * published after the guard is released.
 */
@Slf4j
@RequiredArgsConstructor
public class EngineTransactionTemplate {

    private final ReentrancyGuard guard;
    private final LedgerStore ledgerStore;
    private final EngineEventPublisher eventPublisher;
    private final EngineMetrics metrics;

    public void execute(String operation, String account, Runnable body) {
        execute(operation, account, () -> {
            body.run();
            return null;
        });
    }

    public <T> T execute(String operation, String account, Supplier<T> body) {
        String previousAccount = MDC.get(CorrelationContext.ACCOUNT_MDC_KEY);
        MDC.put(CorrelationContext.ACCOUNT_MDC_KEY, account);
        try {
            Outcome<T> outcome = guard.runExclusive(operation, () -> runInTransaction(operation, body));
            eventPublisher.publish(outcome.events);
            return outcome.result;
        } finally {
            if (previousAccount != null) {
                MDC.put(CorrelationContext.ACCOUNT_MDC_KEY, previousAccount);
            } else {
                MDC.remove(CorrelationContext.ACCOUNT_MDC_KEY);
            }
        }
    }

    private <T> Outcome<T> runInTransaction(String operation, Supplier<T> body) {
        long startTime = System.nanoTime();
        LedgerTransaction tx = ledgerStore.begin(operation);
        try {
            T result = body.get();
            long version = ledgerStore.commit(tx).getVersion();
            Duration duration = Duration.ofNanos(System.nanoTime() - startTime);
            metrics.recordOperation(operation, "success", duration);
            log.info("{} committed: tx={}, ledgerVersion={}, events={}, duration={}ms",
                operation, tx.getId(), version, tx.getEvents().size(), duration.toMillis());
            return new Outcome<>(result, tx.getEvents());
        } catch (Throwable e) {
            ledgerStore.rollback(tx, e);
            Duration duration = Duration.ofNanos(System.nanoTime() - startTime);
            if (e instanceof StablecoinEngineException engineException) {
                metrics.recordOperation(operation, engineException.getErrorCode().name(), duration);
                log.warn("{} rejected: tx={}, code={}, message={}",
                    operation, tx.getId(), engineException.getErrorCode(), e.getMessage());
            } else {
                metrics.recordOperation(operation, "error", duration);
                log.error("{} failed: tx={}, error={}", operation, tx.getId(), e.toString(), e);
            }
            throw e;
        }
    }

    private static final class Outcome<T> {
        private final T result;
        private final List<EngineEvent> events;

        private Outcome(T result, List<EngineEvent> events) {
            this.result = result;
            this.events = events;
        }
    }
}
