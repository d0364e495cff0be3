package com.flagship.stablecoin_engine.health;

import com.flagship.stablecoin_engine.asset.AssetRegistry;
import com.flagship.stablecoin_engine.asset.CollateralAsset;
import com.flagship.stablecoin_engine.engine.ReentrancyGuard;
import com.flagship.stablecoin_engine.ledger.LedgerStore;
import com.flagship.stablecoin_engine.oracle.PriceFeedReader;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final AssetRegistry registry;
    private final PriceFeedReader priceFeedReader;
    private final LedgerStore ledgerStore;
    private final ReentrancyGuard reentrancyGuard;

    public HealthController(AssetRegistry registry,
                            PriceFeedReader priceFeedReader,
                            LedgerStore ledgerStore,
                            ReentrancyGuard reentrancyGuard) {
        this.registry = registry;
        this.priceFeedReader = priceFeedReader;
        this.ledgerStore = ledgerStore;
        this.reentrancyGuard = reentrancyGuard;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("ledgerVersion", ledgerStore.snapshot().getVersion());
        response.put("operationInFlight", reentrancyGuard.isLocked());

        Map<String, String> feeds = new LinkedHashMap<>();
        boolean feedsHealthy = true;
        for (CollateralAsset asset : registry.getAssets()) {
            boolean usable = priceFeedReader.isUsable(asset.getPriceFeedId());
            feeds.put(asset.getPriceFeedId(), usable ? "UP" : "STALE");
            feedsHealthy &= usable;
        }
        response.put("priceFeeds", feeds);

        if (!feedsHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }
}
