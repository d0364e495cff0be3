package com.flagship.stablecoin_engine.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Debt of {@code onBehalfOf} was repaid with tokens pulled from {@code burnedFrom}.
 */
@Value
public class DebtBurnedEvent implements EngineEvent {
    UUID eventId;
    String burnedFrom;
    String onBehalfOf;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DebtBurned";

    @Override
    public String getAccount() {
        return onBehalfOf;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DebtBurnedEvent of(String burnedFrom, String onBehalfOf, BigInteger amount) {
        return new DebtBurnedEvent(UUID.randomUUID(), burnedFrom, onBehalfOf, amount, Instant.now());
    }
}
