package com.flagship.stablecoin_engine.config;

import com.flagship.stablecoin_engine.asset.AssetRegistry;
import com.flagship.stablecoin_engine.custody.CollateralCustody;
import com.flagship.stablecoin_engine.engine.EngineTransactionTemplate;
import com.flagship.stablecoin_engine.engine.ReentrancyGuard;
import com.flagship.stablecoin_engine.engine.StablecoinEngine;
import com.flagship.stablecoin_engine.event.EngineEventPublisher;
import com.flagship.stablecoin_engine.ledger.CollateralLedger;
import com.flagship.stablecoin_engine.ledger.DebtLedger;
import com.flagship.stablecoin_engine.ledger.LedgerStore;
import com.flagship.stablecoin_engine.liquidation.LiquidationEngine;
import com.flagship.stablecoin_engine.observability.EngineMetrics;
import com.flagship.stablecoin_engine.oracle.PriceFeedReader;
import com.flagship.stablecoin_engine.oracle.PriceOracle;
import com.flagship.stablecoin_engine.position.PositionManager;
import com.flagship.stablecoin_engine.simulation.InMemoryCollateralCustody;
import com.flagship.stablecoin_engine.simulation.InMemoryDebtToken;
import com.flagship.stablecoin_engine.simulation.SimulatedPriceOracle;
import com.flagship.stablecoin_engine.solvency.SolvencyCalculator;
import com.flagship.stablecoin_engine.token.DebtToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the engine.
 *
 * Oracle, custody and debt token fall back to in-memory implementations
 * when no other bean of the capability type is defined.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
@Slf4j
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AssetRegistry assetRegistry(EngineProperties properties) {
        AssetRegistry registry = AssetRegistry.of(
            properties.getCollateral().getAssetIds(),
            properties.getCollateral().getPriceFeedIds());
        log.info("Registered collateral assets: {}", registry.getAssets());
        return registry;
    }

    // ==================== Capabilities ====================

    @Bean
    @ConditionalOnMissingBean(PriceOracle.class)
    public SimulatedPriceOracle simulatedPriceOracle(EngineProperties properties, Clock clock) {
        log.warn("No price oracle configured, using simulated oracle seeded with {}",
            properties.getSimulation().getInitialPrices());
        return new SimulatedPriceOracle(clock, properties.getSimulation().getInitialPrices());
    }

    @Bean
    @ConditionalOnMissingBean(CollateralCustody.class)
    public InMemoryCollateralCustody inMemoryCollateralCustody() {
        log.warn("No collateral custody configured, using in-memory custody");
        return new InMemoryCollateralCustody();
    }

    @Bean
    @ConditionalOnMissingBean(DebtToken.class)
    public InMemoryDebtToken inMemoryDebtToken(EngineProperties properties) {
        log.warn("No debt token configured, using in-memory token owned by {}", properties.getCustodyAddress());
        return new InMemoryDebtToken(properties.getCustodyAddress());
    }

    // ==================== Engine ====================

    @Bean
    public PriceFeedReader priceFeedReader(PriceOracle priceOracle, Clock clock) {
        return new PriceFeedReader(priceOracle, clock);
    }

    @Bean
    public LedgerStore ledgerStore() {
        return new LedgerStore();
    }

    @Bean
    public CollateralLedger collateralLedger(LedgerStore ledgerStore) {
        return new CollateralLedger(ledgerStore);
    }

    @Bean
    public DebtLedger debtLedger(LedgerStore ledgerStore) {
        return new DebtLedger(ledgerStore);
    }

    @Bean
    public SolvencyCalculator solvencyCalculator(AssetRegistry registry,
                                                 PriceFeedReader priceFeedReader,
                                                 LedgerStore ledgerStore) {
        return new SolvencyCalculator(registry, priceFeedReader, ledgerStore);
    }

    @Bean
    public PositionManager positionManager(AssetRegistry registry,
                                           CollateralLedger collateralLedger,
                                           DebtLedger debtLedger,
                                           SolvencyCalculator solvencyCalculator,
                                           CollateralCustody custody,
                                           DebtToken debtToken,
                                           LedgerStore ledgerStore,
                                           EngineProperties properties) {
        return new PositionManager(registry, collateralLedger, debtLedger, solvencyCalculator,
            custody, debtToken, ledgerStore, properties.getCustodyAddress());
    }

    @Bean
    public LiquidationEngine liquidationEngine(AssetRegistry registry,
                                               SolvencyCalculator solvencyCalculator,
                                               PositionManager positionManager,
                                               LedgerStore ledgerStore) {
        return new LiquidationEngine(registry, solvencyCalculator, positionManager, ledgerStore);
    }

    @Bean
    public ReentrancyGuard reentrancyGuard() {
        return new ReentrancyGuard();
    }

    @Bean
    public EngineEventPublisher engineEventPublisher(ApplicationEventPublisher applicationEventPublisher,
                                                     EngineMetrics metrics) {
        return new EngineEventPublisher(applicationEventPublisher, metrics);
    }

    @Bean
    public EngineTransactionTemplate engineTransactionTemplate(ReentrancyGuard reentrancyGuard,
                                                               LedgerStore ledgerStore,
                                                               EngineEventPublisher engineEventPublisher,
                                                               EngineMetrics metrics) {
        metrics.registerLedgerVersionGauge(() -> ledgerStore.snapshot().getVersion());
        return new EngineTransactionTemplate(reentrancyGuard, ledgerStore, engineEventPublisher, metrics);
    }

    @Bean
    public StablecoinEngine stablecoinEngine(AssetRegistry registry,
                                             PositionManager positionManager,
                                             LiquidationEngine liquidationEngine,
                                             SolvencyCalculator solvencyCalculator,
                                             LedgerStore ledgerStore,
                                             EngineTransactionTemplate engineTransactionTemplate,
                                             EngineMetrics metrics) {
        return new StablecoinEngine(registry, positionManager, liquidationEngine, solvencyCalculator,
            ledgerStore, engineTransactionTemplate, metrics);
    }
}
