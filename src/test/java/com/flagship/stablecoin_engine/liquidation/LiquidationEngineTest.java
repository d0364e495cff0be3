package com.flagship.stablecoin_engine.liquidation;

import com.flagship.stablecoin_engine.engine.StablecoinEngine;
import com.flagship.stablecoin_engine.event.LiquidationExecutedEvent;
import com.flagship.stablecoin_engine.exception.AssetNotAllowedException;
import com.flagship.stablecoin_engine.exception.BelowMinimumHealthFactorException;
import com.flagship.stablecoin_engine.exception.HealthFactorNotImprovedException;
import com.flagship.stablecoin_engine.exception.InsufficientBalanceException;
import com.flagship.stablecoin_engine.exception.InvalidAmountException;
import com.flagship.stablecoin_engine.exception.NotLiquidatableException;
import com.flagship.stablecoin_engine.exception.TransferFailedException;
import com.flagship.stablecoin_engine.solvency.ProtocolConstants;
import com.flagship.stablecoin_engine.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.flagship.stablecoin_engine.support.EngineFixture.BTC_USD;
import static com.flagship.stablecoin_engine.support.EngineFixture.ETH_USD;
import static com.flagship.stablecoin_engine.support.EngineFixture.WBTC;
import static com.flagship.stablecoin_engine.support.EngineFixture.WETH;
import static com.flagship.stablecoin_engine.support.EngineFixture.units;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Liquidation tests: seize collateral from unhealthy accounts.
 *
 * These tests verify that:
 * - Payout is the covered debt in collateral units plus a 10% bonus
 * - Healthy accounts cannot be liquidated
 * - A liquidation that does not help the account, or hurts the liquidator, is undone
 * - The bonus is not paid from a second asset when the named one runs short
 */
class LiquidationEngineTest {

    private EngineFixture fixture;
    private StablecoinEngine engine;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        engine = fixture.engine;
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    /**
     * User at health factor exactly 1.0, liquidator well collateralized and holding 10000 tokens.
     */
    private void openUserAndLiquidator() {
        fixture.openPosition("user", WETH, units(10), units(10000));
        fixture.openPosition("liquidator", WETH, units(20), units(10000));
    }

    @Test
    @DisplayName("Scenario E: full cover after a price drop pays debt plus 10% in collateral")
    void testScenarioE() {
        printTestHeader("Scenario E");

        openUserAndLiquidator();
        fixture.setPrice(ETH_USD, 1800);
        printInput("ETH price", "$1800");
        printOutput("User health factor", engine.getHealthFactor("user"));
        assertEquals(new BigInteger("900000000000000000"), engine.getHealthFactor("user"));

        BigInteger userBefore = engine.getCollateralBalanceOfUser("user", WETH);
        BigInteger liquidatorBefore = engine.getCollateralBalanceOfUser("liquidator", WETH);

        LiquidationResult result = engine.liquidate("liquidator", WETH, "user", units(10000));

        printOutput("Collateral for debt", result.getCollateralForDebt());
        printOutput("Bonus", result.getBonusCollateral());
        printOutput("Seized", result.getTotalCollateralSeized());
        assertEquals(new BigInteger("5555555555555555555"), result.getCollateralForDebt());
        assertEquals(new BigInteger("555555555555555555"), result.getBonusCollateral());
        assertEquals(new BigInteger("6111111111111111110"), result.getTotalCollateralSeized());
        assertEquals(new BigInteger("3888888888888888890"), engine.getCollateralBalanceOfUser("user", WETH));

        // Ledger conservation between the two accounts
        assertEquals(userBefore.add(liquidatorBefore),
            engine.getCollateralBalanceOfUser("user", WETH).add(engine.getCollateralBalanceOfUser("liquidator", WETH)));

        // Payout physically left custody for the liquidator's wallet
        assertEquals(result.getTotalCollateralSeized(), fixture.wallets().balanceOf(WETH, "liquidator"));
        assertEquals(units(30).subtract(result.getTotalCollateralSeized()), fixture.wallets().custodyBalance(WETH));

        assertEquals(BigInteger.ZERO, fixture.debtLedger.balance("user"));
        assertEquals(BigInteger.ZERO, fixture.debtLedger.balance("liquidator"));
        assertEquals(BigInteger.ZERO, fixture.debtToken.balanceOf("liquidator"));
        assertEquals(units(10000), fixture.token().totalSupply());
        assertEquals(ProtocolConstants.MAX_HEALTH_FACTOR, result.getEndingHealthFactor());
        assertEquals(ProtocolConstants.MAX_HEALTH_FACTOR, engine.getHealthFactor("liquidator"));
        printSuccess("User keeps " + engine.getCollateralBalanceOfUser("user", WETH));
    }

    @Test
    @DisplayName("Liquidation publishes its event and counts the seizure")
    void testLiquidationEventAndMetrics() {
        openUserAndLiquidator();
        fixture.setPrice(ETH_USD, 1800);
        fixture.publishedEvents.clear();

        engine.liquidate("liquidator", WETH, "user", units(10000));

        LiquidationExecutedEvent event = fixture.publishedEvents.stream()
            .filter(e -> e instanceof LiquidationExecutedEvent)
            .map(e -> (LiquidationExecutedEvent) e)
            .findFirst()
            .orElseThrow();
        assertEquals("user", event.getAccount());
        assertEquals("liquidator", event.getLiquidator());
        assertEquals(new BigInteger("900000000000000000"), event.getStartingHealthFactor());
        assertEquals(1, fixture.counter("engine.liquidations", "asset", "WETH"));
    }

    @Test
    @DisplayName("A healthy account cannot be liquidated")
    void testHealthyAccountNotLiquidatable() {
        printTestHeader("Healthy Account");

        openUserAndLiquidator();

        NotLiquidatableException e = assertThrows(NotLiquidatableException.class,
            () -> engine.liquidate("liquidator", WETH, "user", units(100)));

        printExpectedException("NotLiquidatableException", e.getMessage());
        assertThrows(NotLiquidatableException.class,
            () -> engine.liquidate("liquidator", WETH, "debt-free", units(100)));
    }

    @Test
    @DisplayName("Liquidation validates amount and asset")
    void testValidation() {
        assertThrows(InvalidAmountException.class,
            () -> engine.liquidate("liquidator", WETH, "user", BigInteger.ZERO));
        assertThrows(AssetNotAllowedException.class,
            () -> engine.liquidate("liquidator", "DOGE", "user", units(1)));
    }

    @Test
    @DisplayName("A liquidation that lowers the account's health factor is undone")
    void testHealthFactorNotImproved() {
        printTestHeader("Health Factor Not Improved");

        fixture.openPosition("user", WETH, units(10), units(10000));
        fixture.openPosition("liquidator", WETH, units(20), units(1000));
        fixture.setPrice(ETH_USD, 1000);
        printInput("ETH price", "$1000");
        printOutput("User health factor", engine.getHealthFactor("user"));

        HealthFactorNotImprovedException e = assertThrows(HealthFactorNotImprovedException.class,
            () -> engine.liquidate("liquidator", WETH, "user", units(1000)));

        printExpectedException("HealthFactorNotImprovedException", e.getMessage());
        assertEquals(units(10), engine.getCollateralBalanceOfUser("user", WETH));
        assertEquals(units(20), engine.getCollateralBalanceOfUser("liquidator", WETH));
        assertEquals(units(10000), fixture.debtLedger.balance("user"));
        assertEquals(units(1000), fixture.debtLedger.balance("liquidator"));
        assertEquals(units(1000), fixture.debtToken.balanceOf("liquidator"));
        assertEquals(BigInteger.ZERO, fixture.wallets().balanceOf(WETH, "liquidator"));
        assertEquals(units(30), fixture.wallets().custodyBalance(WETH));
    }

    @Test
    @DisplayName("A liquidation that leaves the liquidator unhealthy is undone")
    void testLiquidatorLeftUnhealthy() {
        printTestHeader("Liquidator Left Unhealthy");

        fixture.openPosition("user", WETH, units(10), units(10000));
        fixture.openPosition("liquidator", WETH, units(10), units(10000));
        fixture.setPrice(ETH_USD, 1800);

        BelowMinimumHealthFactorException e = assertThrows(BelowMinimumHealthFactorException.class,
            () -> engine.liquidate("liquidator", WETH, "user", units(100)));

        printOutput("Liquidator health factor", e.getHealthFactor());
        assertTrue(e.getHealthFactor().compareTo(ProtocolConstants.MIN_HEALTH_FACTOR) < 0);
        assertEquals(units(10000), fixture.debtLedger.balance("user"));
        assertEquals(units(10), engine.getCollateralBalanceOfUser("user", WETH));
    }

    @Test
    @DisplayName("The bonus is unpayable at 100% collateralization and no other asset is tapped")
    void testUnpayableBonus() {
        printTestHeader("Unpayable Bonus");

        openUserAndLiquidator();
        fixture.setPrice(ETH_USD, 1000);

        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
            () -> engine.liquidate("liquidator", WETH, "user", units(10000)));

        printExpectedException("InsufficientBalanceException", e.getMessage());
        assertEquals(units(11), e.getRequested());
        assertEquals(units(10), e.getAvailable());
        assertEquals(units(10), engine.getCollateralBalanceOfUser("user", WETH));
    }

    @Test
    @DisplayName("Payout is taken from the named asset only, even when another asset could cover it")
    void testSingleAssetPayout() {
        fixture.fundAndDeposit("user", WETH, units(1));
        fixture.openPosition("user", WBTC, units(18), units(10000));
        fixture.openPosition("liquidator", WETH, units(20), units(10000));
        fixture.setPrice(BTC_USD, 900);

        assertThrows(InsufficientBalanceException.class,
            () -> engine.liquidate("liquidator", WETH, "user", units(5000)));
        assertEquals(units(18), engine.getCollateralBalanceOfUser("user", WBTC));
    }

    @Test
    @DisplayName("A liquidator without tokens fails and the seized collateral goes back")
    void testLiquidatorWithoutTokens() {
        printTestHeader("Liquidator Without Tokens");

        openUserAndLiquidator();
        fixture.debtToken.transferFrom("liquidator", "elsewhere", units(10000));
        fixture.setPrice(ETH_USD, 1800);

        assertThrows(TransferFailedException.class,
            () -> engine.liquidate("liquidator", WETH, "user", units(1000)));

        printOutput("Liquidator wallet", fixture.wallets().balanceOf(WETH, "liquidator"));
        assertEquals(BigInteger.ZERO, fixture.wallets().balanceOf(WETH, "liquidator"));
        assertEquals(units(30), fixture.wallets().custodyBalance(WETH));
        assertEquals(units(10), engine.getCollateralBalanceOfUser("user", WETH));
        assertEquals(units(10000), fixture.debtLedger.balance("user"));
    }
}
