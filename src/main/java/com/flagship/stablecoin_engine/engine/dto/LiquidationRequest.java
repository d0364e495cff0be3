package com.flagship.stablecoin_engine.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

@Value
@Builder
@Jacksonized
public class LiquidationRequest {

    @NotBlank(message = "Asset ID is required")
    @JsonProperty("asset_id")
    String assetId;

    @NotBlank(message = "User is required")
    @JsonProperty("user")
    String user;

    @NotNull(message = "Debt to cover is required")
    @JsonProperty("debt_to_cover")
    BigInteger debtToCover;
}
