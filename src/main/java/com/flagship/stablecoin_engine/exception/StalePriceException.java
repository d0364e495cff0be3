package com.flagship.stablecoin_engine.exception;

import java.util.Map;

/**
 * Oracle data is too old or otherwise unusable. Retrying with a fresh round may succeed.
 */
public class StalePriceException extends StablecoinEngineException {

    private final String priceFeedId;

    public StalePriceException(String priceFeedId, String reason) {
        super(ErrorCode.STALE_PRICE, String.format("Price feed %s is unusable: %s", priceFeedId, reason));
        this.priceFeedId = priceFeedId;
    }

    public String getPriceFeedId() {
        return priceFeedId;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of("price_feed_id", priceFeedId);
    }
}
