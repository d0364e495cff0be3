package com.flagship.stablecoin_engine.observability;

import java.util.Optional;
import java.util.UUID;

/**
 * Correlation id of the request being served on the current thread.
 *
 * Bound by {@link CorrelationIdFilter} for the duration of an HTTP request. Engine
 * events are published synchronously on that thread, so the forwarder can stamp the
 * id on outgoing Kafka records.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_MDC_KEY = "account";

    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Empty outside of a request, e.g. for calls made directly on the engine.
     */
    public static Optional<String> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public static void bind(String correlationId) {
        CURRENT.set(correlationId);
    }

    public static void unbind() {
        CURRENT.remove();
    }

    public static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
