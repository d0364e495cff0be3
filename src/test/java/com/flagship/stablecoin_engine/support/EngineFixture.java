package com.flagship.stablecoin_engine.support;

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
import com.flagship.stablecoin_engine.position.PositionManager;
import com.flagship.stablecoin_engine.simulation.InMemoryCollateralCustody;
import com.flagship.stablecoin_engine.simulation.InMemoryDebtToken;
import com.flagship.stablecoin_engine.simulation.SimulatedPriceOracle;
import com.flagship.stablecoin_engine.solvency.SolvencyCalculator;
import com.flagship.stablecoin_engine.token.DebtToken;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Engine wired by hand the way EngineConfig wires it, with two collateral
 * assets (WETH at $2000, WBTC at $1000) and in-memory collaborators unless
 * others are passed in.
 */
public class EngineFixture {

    public static final String ENGINE_ADDRESS = "stablecoin-engine";
    public static final String WETH = "WETH";
    public static final String WBTC = "WBTC";
    public static final String ETH_USD = "eth-usd";
    public static final String BTC_USD = "btc-usd";

    private static final BigInteger ONE = BigInteger.TEN.pow(18);

    public final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    public final SimulatedPriceOracle oracle = new SimulatedPriceOracle(clock);
    public final CollateralCustody custody;
    public final DebtToken debtToken;
    public final AssetRegistry registry = AssetRegistry.of(List.of(WETH, WBTC), List.of(ETH_USD, BTC_USD));
    public final PriceFeedReader priceFeedReader = new PriceFeedReader(oracle, clock);
    public final LedgerStore ledgerStore = new LedgerStore();
    public final CollateralLedger collateralLedger = new CollateralLedger(ledgerStore);
    public final DebtLedger debtLedger = new DebtLedger(ledgerStore);
    public final SolvencyCalculator solvency = new SolvencyCalculator(registry, priceFeedReader, ledgerStore);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final EngineMetrics metrics = new EngineMetrics(meterRegistry);
    public final List<Object> publishedEvents = new CopyOnWriteArrayList<>();
    public final ReentrancyGuard guard = new ReentrancyGuard();
    public final PositionManager positionManager;
    public final LiquidationEngine liquidationEngine;
    public final StablecoinEngine engine;

    public EngineFixture() {
        this(new InMemoryCollateralCustody(), new InMemoryDebtToken(ENGINE_ADDRESS));
    }

    public EngineFixture(CollateralCustody custody, DebtToken debtToken) {
        this.custody = custody;
        this.debtToken = debtToken;
        setPrice(ETH_USD, 2000);
        setPrice(BTC_USD, 1000);

        positionManager = new PositionManager(registry, collateralLedger, debtLedger, solvency,
            custody, debtToken, ledgerStore, ENGINE_ADDRESS);
        liquidationEngine = new LiquidationEngine(registry, solvency, positionManager, ledgerStore);
        EngineEventPublisher eventPublisher = new EngineEventPublisher(publishedEvents::add, metrics);
        EngineTransactionTemplate template = new EngineTransactionTemplate(guard, ledgerStore, eventPublisher, metrics);
        engine = new StablecoinEngine(registry, positionManager, liquidationEngine, solvency,
            ledgerStore, template, metrics);
    }

    /**
     * Whole tokens to 18-decimal units.
     */
    public static BigInteger units(long whole) {
        return BigInteger.valueOf(whole).multiply(ONE);
    }

    public void setPrice(String priceFeedId, long dollars) {
        oracle.updateAnswer(priceFeedId, BigInteger.valueOf(dollars).multiply(BigInteger.TEN.pow(8)));
    }

    public InMemoryCollateralCustody wallets() {
        return (InMemoryCollateralCustody) custody;
    }

    public InMemoryDebtToken token() {
        return (InMemoryDebtToken) debtToken;
    }

    public void fundAndDeposit(String account, String assetId, BigInteger amount) {
        wallets().fund(assetId, account, amount);
        engine.depositCollateral(account, assetId, amount);
    }

    public void openPosition(String account, String assetId, BigInteger collateral, BigInteger debt) {
        wallets().fund(assetId, account, collateral);
        engine.depositCollateralAndMint(account, assetId, collateral, debt);
    }

    public double counter(String name, String... tags) {
        var counter = meterRegistry.find(name).tags(tags).counter();
        return counter == null ? 0 : counter.count();
    }
}
