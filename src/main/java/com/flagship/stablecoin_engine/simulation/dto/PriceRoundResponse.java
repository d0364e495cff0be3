package com.flagship.stablecoin_engine.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stablecoin_engine.oracle.PriceRound;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

@Value
@Builder
public class PriceRoundResponse {

    @JsonProperty("price_feed_id")
    String priceFeedId;

    @JsonProperty("round_id")
    long roundId;

    @JsonProperty("answer")
    BigInteger answer;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PriceRoundResponse from(String priceFeedId, PriceRound round) {
        return PriceRoundResponse.builder()
            .priceFeedId(priceFeedId)
            .roundId(round.getRoundId())
            .answer(round.getAnswer())
            .updatedAt(round.getUpdatedAt())
            .build();
    }
}
