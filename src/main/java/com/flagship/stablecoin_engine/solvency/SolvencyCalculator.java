package com.flagship.stablecoin_engine.solvency;

import com.flagship.stablecoin_engine.asset.AssetRegistry;
import com.flagship.stablecoin_engine.asset.CollateralAsset;
import com.flagship.stablecoin_engine.exception.BelowMinimumHealthFactorException;
import com.flagship.stablecoin_engine.ledger.LedgerStore;
import com.flagship.stablecoin_engine.ledger.LedgerView;
import com.flagship.stablecoin_engine.oracle.PriceFeedReader;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;

import static com.flagship.stablecoin_engine.solvency.ProtocolConstants.ADDITIONAL_FEED_PRECISION;
import static com.flagship.stablecoin_engine.solvency.ProtocolConstants.LIQUIDATION_BONUS;
import static com.flagship.stablecoin_engine.solvency.ProtocolConstants.LIQUIDATION_PRECISION;
import static com.flagship.stablecoin_engine.solvency.ProtocolConstants.LIQUIDATION_THRESHOLD;
import static com.flagship.stablecoin_engine.solvency.ProtocolConstants.MAX_HEALTH_FACTOR;
import static com.flagship.stablecoin_engine.solvency.ProtocolConstants.MIN_HEALTH_FACTOR;
import static com.flagship.stablecoin_engine.solvency.ProtocolConstants.PRECISION;

/**
 * Read-only solvency math over the ledgers and the oracle.
 *
 * All arithmetic is integer fixed point with truncating division. Each public
 * method reads one {@link LedgerView}, so a single answer never mixes two
 * ledger states. Inside a mutating operation that view is the operation's own
 * transaction.
 */
@RequiredArgsConstructor
public class SolvencyCalculator {

    private final AssetRegistry registry;
    private final PriceFeedReader priceFeedReader;
    private final LedgerStore ledgerStore;

    /**
     * USD value (18 decimals) of {@code amount} units of the asset.
     */
    public BigInteger usdValue(String assetId, BigInteger amount) {
        BigInteger price = priceFeedReader.latestPrice(registry.priceFeedOf(assetId));
        return price.multiply(ADDITIONAL_FEED_PRECISION).multiply(amount).divide(PRECISION);
    }

    /**
     * Asset units worth {@code usdAmount}; the inverse of {@link #usdValue}.
     */
    public BigInteger usdToAssetAmount(String assetId, BigInteger usdAmount) {
        BigInteger price = priceFeedReader.latestPrice(registry.priceFeedOf(assetId));
        return usdAmount.multiply(PRECISION).divide(price.multiply(ADDITIONAL_FEED_PRECISION));
    }

    public BigInteger totalCollateralUsd(String account) {
        return totalCollateralUsd(ledgerStore.view(), account);
    }

    public BigInteger healthFactor(String account) {
        return healthFactor(ledgerStore.view(), account);
    }

    public BigInteger healthFactor(LedgerView view, String account) {
        BigInteger debt = view.debtOf(account);
        if (debt.signum() == 0) {
            return MAX_HEALTH_FACTOR;
        }
        return calculateHealthFactor(debt, totalCollateralUsd(view, account));
    }

    /**
     * Health factor for an arbitrary debt/collateral pair. No debt means
     * {@link ProtocolConstants#MAX_HEALTH_FACTOR}.
     */
    public BigInteger calculateHealthFactor(BigInteger debt, BigInteger collateralUsd) {
        if (debt.signum() == 0) {
            return MAX_HEALTH_FACTOR;
        }
        BigInteger adjusted = collateralUsd.multiply(LIQUIDATION_THRESHOLD).divide(LIQUIDATION_PRECISION);
        return adjusted.multiply(PRECISION).divide(debt);
    }

    /**
     * @throws BelowMinimumHealthFactorException carrying the computed value
     */
    public void assertHealthy(String account) {
        BigInteger healthFactor = healthFactor(account);
        if (healthFactor.compareTo(MIN_HEALTH_FACTOR) < 0) {
            throw new BelowMinimumHealthFactorException(account, healthFactor);
        }
    }

    public boolean isHealthy(BigInteger healthFactor) {
        return healthFactor.compareTo(MIN_HEALTH_FACTOR) >= 0;
    }

    /**
     * The most debt the account could carry while staying exactly at the minimum health factor.
     */
    public BigInteger maxMintableUsd(String account) {
        return totalCollateralUsd(account).multiply(LIQUIDATION_THRESHOLD).divide(LIQUIDATION_PRECISION);
    }

    /**
     * Bonus collateral a liquidator would receive for covering {@code debtToCover}.
     */
    public BigInteger liquidationBonus(String assetId, BigInteger debtToCover) {
        return bonusOn(usdToAssetAmount(assetId, debtToCover));
    }

    public BigInteger bonusOn(BigInteger collateralAmount) {
        return collateralAmount.multiply(LIQUIDATION_BONUS).divide(LIQUIDATION_PRECISION);
    }

    public BigInteger totalCollateralUsd(LedgerView view, String account) {
        BigInteger total = BigInteger.ZERO;
        for (CollateralAsset asset : registry.getAssets()) {
            BigInteger amount = view.collateralOf(account, asset.getAssetId());
            total = total.add(usdValue(asset.getAssetId(), amount));
        }
        return total;
    }
}
