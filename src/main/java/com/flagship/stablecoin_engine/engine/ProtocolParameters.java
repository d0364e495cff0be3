package com.flagship.stablecoin_engine.engine;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class ProtocolParameters {
    BigInteger liquidationThreshold;
    BigInteger liquidationBonus;
    BigInteger liquidationPrecision;
    BigInteger minHealthFactor;
    BigInteger precision;
    BigInteger additionalFeedPrecision;
    long oracleTimeoutSeconds;
}
