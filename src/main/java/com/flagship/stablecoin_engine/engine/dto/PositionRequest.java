package com.flagship.stablecoin_engine.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

/**
 * Body of the combined open (deposit and mint) and close (burn and redeem) calls.
 */
@Value
@Builder
@Jacksonized
public class PositionRequest {

    @NotBlank(message = "Asset ID is required")
    @JsonProperty("asset_id")
    String assetId;

    @NotNull(message = "Collateral amount is required")
    @JsonProperty("collateral_amount")
    BigInteger collateralAmount;

    @NotNull(message = "Debt amount is required")
    @JsonProperty("debt_amount")
    BigInteger debtAmount;
}
