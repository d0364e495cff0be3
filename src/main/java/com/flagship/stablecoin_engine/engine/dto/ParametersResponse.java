package com.flagship.stablecoin_engine.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stablecoin_engine.engine.ProtocolParameters;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class ParametersResponse {

    @JsonProperty("liquidation_threshold")
    BigInteger liquidationThreshold;

    @JsonProperty("liquidation_bonus")
    BigInteger liquidationBonus;

    @JsonProperty("liquidation_precision")
    BigInteger liquidationPrecision;

    @JsonProperty("min_health_factor")
    BigInteger minHealthFactor;

    @JsonProperty("precision")
    BigInteger precision;

    @JsonProperty("additional_feed_precision")
    BigInteger additionalFeedPrecision;

    @JsonProperty("oracle_timeout_seconds")
    long oracleTimeoutSeconds;

    public static ParametersResponse from(ProtocolParameters parameters) {
        return ParametersResponse.builder()
            .liquidationThreshold(parameters.getLiquidationThreshold())
            .liquidationBonus(parameters.getLiquidationBonus())
            .liquidationPrecision(parameters.getLiquidationPrecision())
            .minHealthFactor(parameters.getMinHealthFactor())
            .precision(parameters.getPrecision())
            .additionalFeedPrecision(parameters.getAdditionalFeedPrecision())
            .oracleTimeoutSeconds(parameters.getOracleTimeoutSeconds())
            .build();
    }
}
