package com.flagship.stablecoin_engine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    /**
     * Address under which the engine holds collateral and debt tokens.
     */
    private String custodyAddress = "stablecoin-engine";

    private Collateral collateral = new Collateral();
    private Simulation simulation = new Simulation();
    private Events events = new Events();

    @Getter
    @Setter
    public static class Collateral {
        private List<String> assetIds = new ArrayList<>();
        /**
         * Parallel to assetIds: the n-th feed prices the n-th asset.
         */
        private List<String> priceFeedIds = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Simulation {
        /**
         * 8-decimal answers keyed by price feed id.
         */
        private Map<String, BigInteger> initialPrices = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Events {
        private Kafka kafka = new Kafka();
    }

    @Getter
    @Setter
    public static class Kafka {
        private boolean enabled = false;
        private String topic = "stablecoin-engine-events";
    }
}
