package com.flagship.stablecoin_engine.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for engine events.
 *
 * Events are facts: they are recorded while an operation runs and published
 * only once its ledger transaction has committed.
 */
public interface EngineEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * The account this event is about. Used as the partition key.
     */
    String getAccount();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
