package com.flagship.stablecoin_engine.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
public class DebtMintedEvent implements EngineEvent {
    UUID eventId;
    String account;
    BigInteger amount;
    BigInteger healthFactor;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DebtMinted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DebtMintedEvent of(String account, BigInteger amount, BigInteger healthFactor) {
        return new DebtMintedEvent(UUID.randomUUID(), account, amount, healthFactor, Instant.now());
    }
}
