package com.flagship.stablecoin_engine.observability;

import com.flagship.stablecoin_engine.asset.AssetRegistry;
import com.flagship.stablecoin_engine.asset.CollateralAsset;
import com.flagship.stablecoin_engine.oracle.PriceFeedReader;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Custom health indicators for the stablecoin engine.
 */
public class HealthIndicators {

    /**
     * DOWN when any registered collateral feed is stale: every valuation, and
     * so every mutating operation, would fail with STALE_PRICE.
     */
    @Component("priceFeeds")
    public static class PriceFeedHealthIndicator implements HealthIndicator {

        private final AssetRegistry registry;
        private final PriceFeedReader priceFeedReader;

        public PriceFeedHealthIndicator(AssetRegistry registry, PriceFeedReader priceFeedReader) {
            this.registry = registry;
            this.priceFeedReader = priceFeedReader;
        }

        @Override
        public Health health() {
            List<String> stale = new ArrayList<>();
            for (CollateralAsset asset : registry.getAssets()) {
                if (!priceFeedReader.isUsable(asset.getPriceFeedId())) {
                    stale.add(asset.getPriceFeedId());
                }
            }

            Health.Builder builder = stale.isEmpty() ? Health.up() : Health.down();
            return builder
                    .withDetail("feeds", registry.getAssets().size())
                    .withDetail("staleFeeds", stale)
                    .withDetail("timeoutSeconds", PriceFeedReader.TIMEOUT.getSeconds())
                    .build();
        }
    }
}
