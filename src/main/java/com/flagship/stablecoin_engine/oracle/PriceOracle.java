package com.flagship.stablecoin_engine.oracle;

import java.util.Optional;

/**
 * Spot price source. Staleness is not checked here; see {@link PriceFeedReader}.
 */
public interface PriceOracle {

    /**
     * Latest round for the feed, or empty if the feed has never reported.
     */
    Optional<PriceRound> latestRoundData(String priceFeedId);
}
