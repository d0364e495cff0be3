package com.flagship.stablecoin_engine.liquidation;

import com.flagship.stablecoin_engine.asset.AssetRegistry;
import com.flagship.stablecoin_engine.event.LiquidationExecutedEvent;
import com.flagship.stablecoin_engine.exception.HealthFactorNotImprovedException;
import com.flagship.stablecoin_engine.exception.InvalidAmountException;
import com.flagship.stablecoin_engine.exception.NotLiquidatableException;
import com.flagship.stablecoin_engine.ledger.LedgerStore;
import com.flagship.stablecoin_engine.position.PositionManager;
import com.flagship.stablecoin_engine.solvency.SolvencyCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Seizes collateral from an undercollateralized account and settles the
 * matching debt with the liquidator's tokens.
 *
 * Steps, all inside the caller's ledger transaction:
 * <ol>
 *   <li>the account must be below the minimum health factor</li>
 *   <li>debtToCover is converted to collateral units and a 10% bonus added</li>
 *   <li>that payout is redeemed from the account to the liquidator</li>
 *   <li>the liquidator's tokens repay debtToCover of the account's debt</li>
 *   <li>the account's health factor must have gone up</li>
 *   <li>the liquidator must still be healthy</li>
 * </ol>
 * The payout is taken from the one asset named by the caller. If the account
 * holds less of it than the payout, which happens once its holdings in that
 * asset are worth under 110% of debtToCover, the redeem step fails with
 * InsufficientBalance; no other asset is tapped.
 */
@Slf4j
@RequiredArgsConstructor
public class LiquidationEngine {

    private final AssetRegistry registry;
    private final SolvencyCalculator solvency;
    private final PositionManager positionManager;
    private final LedgerStore ledgerStore;

    public LiquidationResult liquidate(String liquidator, String assetId, String user, BigInteger debtToCover) {
        if (debtToCover == null || debtToCover.signum() <= 0) {
            throw new InvalidAmountException("debtToCover", debtToCover);
        }
        registry.require(assetId);

        BigInteger startingHealthFactor = solvency.healthFactor(user);
        if (solvency.isHealthy(startingHealthFactor)) {
            throw new NotLiquidatableException(user, startingHealthFactor);
        }

        BigInteger collateralForDebt = solvency.usdToAssetAmount(assetId, debtToCover);
        BigInteger bonusCollateral = solvency.bonusOn(collateralForDebt);
        BigInteger payout = collateralForDebt.add(bonusCollateral);

        log.debug("Liquidation sizing: user={}, asset={}, debtToCover={}, collateralForDebt={}, bonus={}",
            user, assetId, debtToCover, collateralForDebt, bonusCollateral);

        positionManager.redeem(user, liquidator, assetId, payout);
        positionManager.burn(liquidator, user, debtToCover);

        BigInteger endingHealthFactor = solvency.healthFactor(user);
        if (endingHealthFactor.compareTo(startingHealthFactor) <= 0) {
            throw new HealthFactorNotImprovedException(user, startingHealthFactor, endingHealthFactor);
        }
        solvency.assertHealthy(liquidator);

        LiquidationResult result = LiquidationResult.builder()
            .user(user)
            .liquidator(liquidator)
            .assetId(assetId)
            .debtCovered(debtToCover)
            .collateralForDebt(collateralForDebt)
            .bonusCollateral(bonusCollateral)
            .startingHealthFactor(startingHealthFactor)
            .endingHealthFactor(endingHealthFactor)
            .build();
        ledgerStore.currentTransaction().record(LiquidationExecutedEvent.fromResult(result));
        return result;
    }
}
