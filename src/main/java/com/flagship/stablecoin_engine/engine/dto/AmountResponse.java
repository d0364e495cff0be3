package com.flagship.stablecoin_engine.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

/**
 * Single-value answer of a conversion or balance query.
 */
@Value
public class AmountResponse {

    @JsonProperty("asset_id")
    String assetId;

    @JsonProperty("value")
    BigInteger value;
}
