package com.flagship.stablecoin_engine.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stablecoin_engine.liquidation.LiquidationResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class LiquidationResponse {

    @JsonProperty("user")
    String user;

    @JsonProperty("liquidator")
    String liquidator;

    @JsonProperty("asset_id")
    String assetId;

    @JsonProperty("debt_covered")
    BigInteger debtCovered;

    @JsonProperty("collateral_for_debt")
    BigInteger collateralForDebt;

    @JsonProperty("bonus_collateral")
    BigInteger bonusCollateral;

    @JsonProperty("total_collateral_seized")
    BigInteger totalCollateralSeized;

    @JsonProperty("starting_health_factor")
    BigInteger startingHealthFactor;

    @JsonProperty("ending_health_factor")
    BigInteger endingHealthFactor;

    public static LiquidationResponse from(LiquidationResult result) {
        return LiquidationResponse.builder()
            .user(result.getUser())
            .liquidator(result.getLiquidator())
            .assetId(result.getAssetId())
            .debtCovered(result.getDebtCovered())
            .collateralForDebt(result.getCollateralForDebt())
            .bonusCollateral(result.getBonusCollateral())
            .totalCollateralSeized(result.getTotalCollateralSeized())
            .startingHealthFactor(result.getStartingHealthFactor())
            .endingHealthFactor(result.getEndingHealthFactor())
            .build();
    }
}
