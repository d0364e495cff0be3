package com.flagship.stablecoin_engine.oracle;

import com.flagship.stablecoin_engine.exception.StalePriceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reads feed answers through {@link PriceOracle} and refuses data that
 * should not be used for valuation.
 *
 * A round is rejected when it is older than {@link #TIMEOUT}, was never
 * updated, was carried over from an earlier round, or has a non-positive answer.
 */
@Slf4j
@RequiredArgsConstructor
public class PriceFeedReader {

    public static final Duration TIMEOUT = Duration.ofHours(3);

    private final PriceOracle oracle;
    private final Clock clock;

    /**
     * @return the latest answer, 8-decimal fixed point
     * @throws StalePriceException if the round is unusable
     */
    public BigInteger latestPrice(String priceFeedId) {
        PriceRound round = oracle.latestRoundData(priceFeedId)
            .orElseThrow(() -> new StalePriceException(priceFeedId, "no round reported"));

        Instant updatedAt = round.getUpdatedAt();
        if (updatedAt == null || updatedAt.equals(Instant.EPOCH)) {
            throw new StalePriceException(priceFeedId, "round " + round.getRoundId() + " was never updated");
        }
        if (round.getAnsweredInRound() < round.getRoundId()) {
            throw new StalePriceException(priceFeedId,
                String.format("round %d answered in earlier round %d", round.getRoundId(), round.getAnsweredInRound()));
        }

        Duration age = Duration.between(updatedAt, clock.instant());
        if (age.compareTo(TIMEOUT) > 0) {
            log.warn("Stale price rejected: feed={}, age={}s, timeout={}s",
                priceFeedId, age.getSeconds(), TIMEOUT.getSeconds());
            throw new StalePriceException(priceFeedId, "last update " + age.getSeconds() + "s ago");
        }

        BigInteger answer = round.getAnswer();
        if (answer == null || answer.signum() <= 0) {
            throw new StalePriceException(priceFeedId, "non-positive answer " + answer);
        }
        return answer;
    }

    /**
     * Non-throwing variant used by health reporting.
     */
    public boolean isUsable(String priceFeedId) {
        try {
            latestPrice(priceFeedId);
            return true;
        } catch (StalePriceException e) {
            return false;
        }
    }
}
