package com.flagship.stablecoin_engine.event;

import com.flagship.stablecoin_engine.ledger.EntryType;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * A single credit or debit applied to the collateral or debt ledger.
 * {@code assetId} is null for debt entries.
 */
@Value
public class LedgerChangedEvent implements EngineEvent {
    UUID eventId;
    LedgerType ledger;
    String account;
    String assetId;
    BigInteger amount;
    EntryType direction;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerChangedEvent collateral(String account, String assetId, BigInteger amount, EntryType direction) {
        return new LedgerChangedEvent(UUID.randomUUID(), LedgerType.COLLATERAL, account, assetId, amount, direction, Instant.now());
    }

    public static LedgerChangedEvent debt(String account, BigInteger amount, EntryType direction) {
        return new LedgerChangedEvent(UUID.randomUUID(), LedgerType.DEBT, account, null, amount, direction, Instant.now());
    }
}
