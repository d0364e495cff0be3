package com.flagship.stablecoin_engine.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class TokenSupplyResponse {

    @JsonProperty("total_supply")
    BigInteger totalSupply;
}
