package com.flagship.stablecoin_engine.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for engine operations.
 *
 * Metrics exposed:
 * - engine.operations: Counter of mutating operations, tagged by operation and outcome
 * - engine.operation.duration: Timer per operation
 * - engine.liquidations: Counter of successful liquidations per asset
 * - engine.liquidation.collateral_seized: Summary of seized collateral (whole units) per asset
 * - engine.events.published / engine.events.publish.failure: event delivery
 * - engine.ledger.version: Gauge of the committed ledger snapshot version
 */
@Component
public class EngineMetrics {

    private static final BigDecimal UNITS_PER_TOKEN = new BigDecimal(BigInteger.TEN.pow(18));

    private final MeterRegistry registry;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ==================== Operation Metrics ====================

    /**
     * Records one mutating operation. {@code outcome} is "success" or an error code.
     */
    public void recordOperation(String operation, String outcome, Duration duration) {
        registry.counter("engine.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
        registry.timer("engine.operation.duration",
                "operation", sanitizeTag(operation)
        ).record(duration);
    }

    // ==================== Liquidation Metrics ====================

    public void recordLiquidation(String assetId, BigInteger collateralSeized) {
        registry.counter("engine.liquidations", "asset", sanitizeTag(assetId)).increment();
        DistributionSummary.builder("engine.liquidation.collateral_seized")
                .description("Collateral seized per liquidation, in whole asset units")
                .tag("asset", sanitizeTag(assetId))
                .register(registry)
                .record(new BigDecimal(collateralSeized).divide(UNITS_PER_TOKEN).doubleValue());
    }

    // ==================== Event Metrics ====================

    public void recordEventPublished(String eventType) {
        registry.counter("engine.events.published", "event_type", sanitizeTag(eventType)).increment();
    }

    public void recordEventPublishFailure(String eventType, String channel) {
        registry.counter("engine.events.publish.failure",
                "event_type", sanitizeTag(eventType),
                "channel", sanitizeTag(channel)
        ).increment();
    }

    // ==================== Gauge Methods ====================

    public void registerLedgerVersionGauge(Supplier<Number> supplier) {
        Gauge.builder("engine.ledger.version", supplier, s -> s.get().doubleValue())
                .description("Version of the committed ledger snapshot")
                .strongReference(true)
                .register(registry);
    }

    // ==================== Helper Methods ====================

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
