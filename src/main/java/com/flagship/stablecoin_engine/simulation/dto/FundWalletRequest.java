package com.flagship.stablecoin_engine.simulation.dto;

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
public class FundWalletRequest {

    @NotBlank(message = "Asset ID is required")
    @JsonProperty("asset_id")
    String assetId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigInteger amount;
}
