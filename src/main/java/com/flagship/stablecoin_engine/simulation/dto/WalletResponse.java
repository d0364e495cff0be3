package com.flagship.stablecoin_engine.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class WalletResponse {

    @JsonProperty("holder")
    String holder;

    @JsonProperty("asset_id")
    String assetId;

    @JsonProperty("balance")
    BigInteger balance;
}
