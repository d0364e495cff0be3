package com.flagship.stablecoin_engine.simulation;

import com.flagship.stablecoin_engine.oracle.PriceOracle;
import com.flagship.stablecoin_engine.oracle.PriceRound;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Price oracle whose rounds are pushed by hand, for local runs and tests.
 *
 * Each pushed answer starts a new round, stamped with the current clock time
 * unless the caller backdates it.
 */
@Slf4j
public class SimulatedPriceOracle implements PriceOracle {

    private final Clock clock;
    private final Map<String, PriceRound> rounds = new ConcurrentHashMap<>();

    public SimulatedPriceOracle(Clock clock) {
        this(clock, Map.of());
    }

    public SimulatedPriceOracle(Clock clock, Map<String, BigInteger> initialAnswers) {
        this.clock = clock;
        initialAnswers.forEach(this::updateAnswer);
    }

    @Override
    public Optional<PriceRound> latestRoundData(String priceFeedId) {
        return Optional.ofNullable(rounds.get(priceFeedId));
    }

    public PriceRound updateAnswer(String priceFeedId, BigInteger answer) {
        return updateAnswer(priceFeedId, answer, clock.instant());
    }

    /**
     * Starts a new round stamped {@code updatedAt}; a past instant simulates a feed that stopped reporting.
     */
    public PriceRound updateAnswer(String priceFeedId, BigInteger answer, Instant updatedAt) {
        PriceRound round = rounds.compute(priceFeedId, (feed, previous) -> {
            long roundId = previous == null ? 1 : previous.getRoundId() + 1;
            return new PriceRound(roundId, answer, updatedAt, roundId);
        });
        log.info("Price feed updated: feed={}, round={}, answer={}, updatedAt={}",
            priceFeedId, round.getRoundId(), answer, updatedAt);
        return round;
    }
}
