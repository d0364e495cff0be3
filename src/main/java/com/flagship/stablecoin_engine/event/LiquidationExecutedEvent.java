package com.flagship.stablecoin_engine.event;

import com.flagship.stablecoin_engine.liquidation.LiquidationResult;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
public class LiquidationExecutedEvent implements EngineEvent {
    UUID eventId;
    String account;
    String liquidator;
    String assetId;
    BigInteger debtCovered;
    BigInteger collateralSeized;
    BigInteger bonusCollateral;
    BigInteger startingHealthFactor;
    BigInteger endingHealthFactor;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LiquidationExecuted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LiquidationExecutedEvent fromResult(LiquidationResult result) {
        return new LiquidationExecutedEvent(
            UUID.randomUUID(),
            result.getUser(),
            result.getLiquidator(),
            result.getAssetId(),
            result.getDebtCovered(),
            result.getTotalCollateralSeized(),
            result.getBonusCollateral(),
            result.getStartingHealthFactor(),
            result.getEndingHealthFactor(),
            Instant.now()
        );
    }
}
