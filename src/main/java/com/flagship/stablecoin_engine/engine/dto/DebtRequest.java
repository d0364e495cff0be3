package com.flagship.stablecoin_engine.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

@Value
@Builder
@Jacksonized
public class DebtRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigInteger amount;
}
