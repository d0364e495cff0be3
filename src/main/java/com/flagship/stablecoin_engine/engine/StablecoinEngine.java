package com.flagship.stablecoin_engine.engine;

import com.flagship.stablecoin_engine.asset.AssetRegistry;
import com.flagship.stablecoin_engine.asset.CollateralAsset;
import com.flagship.stablecoin_engine.exception.InvalidAmountException;
import com.flagship.stablecoin_engine.ledger.LedgerStore;
import com.flagship.stablecoin_engine.ledger.LedgerView;
import com.flagship.stablecoin_engine.liquidation.LiquidationEngine;
import com.flagship.stablecoin_engine.liquidation.LiquidationResult;
import com.flagship.stablecoin_engine.observability.EngineMetrics;
import com.flagship.stablecoin_engine.oracle.PriceFeedReader;
import com.flagship.stablecoin_engine.position.PositionManager;
import com.flagship.stablecoin_engine.solvency.ProtocolConstants;
import com.flagship.stablecoin_engine.solvency.SolvencyCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;

/**
 * Entry point for every engine operation.
 *
 * <h2>Mutating operations</h2>
 * Each runs under the global reentrancy guard inside one ledger transaction
 * (see {@link EngineTransactionTemplate}). Either every step takes effect or
 * none does; a typed {@code StablecoinEngineException} reports the first
 * failed step.
 *
 * <h2>Queries</h2>
 * Take no lock and read the latest committed ledger snapshot. A query that
 * needs several ledger values reads them all from the same snapshot.
 */
@Slf4j
@RequiredArgsConstructor
public class StablecoinEngine {

    private final AssetRegistry registry;
    private final PositionManager positionManager;
    private final LiquidationEngine liquidationEngine;
    private final SolvencyCalculator solvency;
    private final LedgerStore ledgerStore;
    private final EngineTransactionTemplate transactionTemplate;
    private final EngineMetrics metrics;

    // ==================== Mutating Operations ====================

    public void depositCollateral(String account, String assetId, BigInteger amount) {
        transactionTemplate.execute("depositCollateral", account,
            () -> positionManager.depositCollateral(account, assetId, amount));
    }

    public void mintDebt(String account, BigInteger amount) {
        transactionTemplate.execute("mintDebt", account,
            () -> positionManager.mintDebt(account, amount));
    }

    public void depositCollateralAndMint(String account, String assetId,
                                         BigInteger collateralAmount, BigInteger debtAmount) {
        transactionTemplate.execute("depositCollateralAndMint", account, () -> {
            positionManager.depositCollateral(account, assetId, collateralAmount);
            positionManager.mintDebt(account, debtAmount);
        });
    }

    public void redeemCollateral(String account, String assetId, BigInteger amount) {
        transactionTemplate.execute("redeemCollateral", account,
            () -> positionManager.redeemCollateral(account, assetId, amount));
    }

    public void burnDebt(String account, BigInteger amount) {
        transactionTemplate.execute("burnDebt", account,
            () -> positionManager.burnDebt(account, amount));
    }

    /**
     * Burns first so the redeem is checked against the reduced debt.
     */
    public void redeemAndBurn(String account, String assetId,
                              BigInteger collateralAmount, BigInteger debtAmount) {
        transactionTemplate.execute("redeemAndBurn", account, () -> {
            positionManager.repayDebt(account, debtAmount);
            positionManager.redeemCollateral(account, assetId, collateralAmount);
        });
    }

    public LiquidationResult liquidate(String liquidator, String assetId, String user, BigInteger debtToCover) {
        LiquidationResult result = transactionTemplate.execute("liquidate", liquidator,
            () -> liquidationEngine.liquidate(liquidator, assetId, user, debtToCover));
        metrics.recordLiquidation(assetId, result.getTotalCollateralSeized());
        log.info("Liquidated {}: liquidator={}, asset={}, debtCovered={}, seized={}, healthFactor {} -> {}",
            user, liquidator, assetId, result.getDebtCovered(), result.getTotalCollateralSeized(),
            result.getStartingHealthFactor(), result.getEndingHealthFactor());
        return result;
    }

    // ==================== Queries ====================

    public AccountInformation getAccountInformation(String account) {
        LedgerView view = ledgerStore.view();
        BigInteger debt = view.debtOf(account);
        BigInteger collateralUsd = solvency.totalCollateralUsd(view, account);
        return AccountInformation.builder()
            .account(account)
            .totalDebtMinted(debt)
            .collateralValueUsd(collateralUsd)
            .healthFactor(solvency.calculateHealthFactor(debt, collateralUsd))
            .maxMintableUsd(collateralUsd
                .multiply(ProtocolConstants.LIQUIDATION_THRESHOLD)
                .divide(ProtocolConstants.LIQUIDATION_PRECISION))
            .build();
    }

    public BigInteger getHealthFactor(String account) {
        return solvency.healthFactor(account);
    }

    public BigInteger calculateHealthFactor(BigInteger debt, BigInteger collateralUsd) {
        requireNonNegative("debt", debt);
        requireNonNegative("collateralUsd", collateralUsd);
        return solvency.calculateHealthFactor(debt, collateralUsd);
    }

    public BigInteger getAccountCollateralValue(String account) {
        return solvency.totalCollateralUsd(account);
    }

    public BigInteger getCollateralBalanceOfUser(String account, String assetId) {
        registry.require(assetId);
        return ledgerStore.view().collateralOf(account, assetId);
    }

    public List<CollateralAsset> getCollateralAssets() {
        return registry.getAssets();
    }

    public String getCollateralPriceFeed(String assetId) {
        return registry.priceFeedOf(assetId);
    }

    public BigInteger getUsdValue(String assetId, BigInteger amount) {
        requireNonNegative("amount", amount);
        return solvency.usdValue(assetId, amount);
    }

    public BigInteger getTokenAmountFromUsd(String assetId, BigInteger usdAmount) {
        requireNonNegative("usdAmount", usdAmount);
        return solvency.usdToAssetAmount(assetId, usdAmount);
    }

    public BigInteger getMaxMintableUsd(String account) {
        return solvency.maxMintableUsd(account);
    }

    public BigInteger previewLiquidationBonus(String assetId, BigInteger debtToCover) {
        requireNonNegative("debtToCover", debtToCover);
        return solvency.liquidationBonus(assetId, debtToCover);
    }

    public ProtocolParameters getParameters() {
        return ProtocolParameters.builder()
            .liquidationThreshold(ProtocolConstants.LIQUIDATION_THRESHOLD)
            .liquidationBonus(ProtocolConstants.LIQUIDATION_BONUS)
            .liquidationPrecision(ProtocolConstants.LIQUIDATION_PRECISION)
            .minHealthFactor(ProtocolConstants.MIN_HEALTH_FACTOR)
            .precision(ProtocolConstants.PRECISION)
            .additionalFeedPrecision(ProtocolConstants.ADDITIONAL_FEED_PRECISION)
            .oracleTimeoutSeconds(PriceFeedReader.TIMEOUT.getSeconds())
            .build();
    }

    public long getLedgerVersion() {
        return ledgerStore.snapshot().getVersion();
    }

    private static void requireNonNegative(String field, BigInteger value) {
        if (value == null || value.signum() < 0) {
            throw new InvalidAmountException(field, value);
        }
    }
}
