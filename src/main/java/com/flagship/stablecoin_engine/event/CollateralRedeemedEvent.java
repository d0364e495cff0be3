package com.flagship.stablecoin_engine.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Collateral left the account of {@code redeemedFrom} and was sent to {@code redeemedTo}.
 * The two differ only during liquidation.
 */
@Value
public class CollateralRedeemedEvent implements EngineEvent {
    UUID eventId;
    String redeemedFrom;
    String redeemedTo;
    String assetId;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CollateralRedeemed";

    @Override
    public String getAccount() {
        return redeemedFrom;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CollateralRedeemedEvent of(String redeemedFrom, String redeemedTo, String assetId, BigInteger amount) {
        return new CollateralRedeemedEvent(UUID.randomUUID(), redeemedFrom, redeemedTo, assetId, amount, Instant.now());
    }
}
