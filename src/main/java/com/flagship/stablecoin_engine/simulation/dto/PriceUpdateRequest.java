package com.flagship.stablecoin_engine.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.time.Instant;

/**
 * New feed answer, 8-decimal fixed point.
 */
@Value
@Builder
@Jacksonized
public class PriceUpdateRequest {

    @NotNull(message = "Answer is required")
    @JsonProperty("answer")
    BigInteger answer;

    /**
     * Optional; defaults to now.
     */
    @JsonProperty("updated_at")
    Instant updatedAt;
}
