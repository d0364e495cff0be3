package com.flagship.stablecoin_engine.liquidation;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a successful liquidation. Collateral amounts are in asset units,
 * {@code debtCovered} in debt units.
 */
@Value
@Builder
public class LiquidationResult {
    String user;
    String liquidator;
    String assetId;
    BigInteger debtCovered;
    BigInteger collateralForDebt;
    BigInteger bonusCollateral;
    BigInteger startingHealthFactor;
    BigInteger endingHealthFactor;

    public BigInteger getTotalCollateralSeized() {
        return collateralForDebt.add(bonusCollateral);
    }
}
