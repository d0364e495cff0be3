package com.flagship.stablecoin_engine.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

/**
 * Body of a collateral deposit or redeem. Amounts are raw 18-decimal units.
 */
@Value
@Builder
@Jacksonized
public class CollateralRequest {

    @NotBlank(message = "Asset ID is required")
    @JsonProperty("asset_id")
    String assetId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigInteger amount;
}
