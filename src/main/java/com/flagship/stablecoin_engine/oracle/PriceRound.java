package com.flagship.stablecoin_engine.oracle;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One round reported by a price feed. Answers are 8-decimal fixed point USD.
 */
@Value
public class PriceRound {
    long roundId;
    BigInteger answer;
    Instant updatedAt;
    long answeredInRound;
}
