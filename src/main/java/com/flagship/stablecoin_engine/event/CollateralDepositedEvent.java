package com.flagship.stablecoin_engine.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
public class CollateralDepositedEvent implements EngineEvent {
    UUID eventId;
    String account;
    String assetId;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CollateralDeposited";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CollateralDepositedEvent of(String account, String assetId, BigInteger amount) {
        return new CollateralDepositedEvent(UUID.randomUUID(), account, assetId, amount, Instant.now());
    }
}
