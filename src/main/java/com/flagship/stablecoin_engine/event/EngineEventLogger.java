package com.flagship.stablecoin_engine.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Audit trail of committed engine events in the application log.
 */
@Component
@Slf4j
public class EngineEventLogger {

    @EventListener
    public void onLedgerChanged(LedgerChangedEvent event) {
        log.debug("Ledger {} {}: account={}, asset={}, amount={}",
            event.getLedger(), event.getDirection(), event.getAccount(), event.getAssetId(), event.getAmount());
    }

    @EventListener
    public void onCollateralDeposited(CollateralDepositedEvent event) {
        log.info("Collateral deposited: account={}, asset={}, amount={}",
            event.getAccount(), event.getAssetId(), event.getAmount());
    }

    @EventListener
    public void onCollateralRedeemed(CollateralRedeemedEvent event) {
        log.info("Collateral redeemed: from={}, to={}, asset={}, amount={}",
            event.getRedeemedFrom(), event.getRedeemedTo(), event.getAssetId(), event.getAmount());
    }

    @EventListener
    public void onDebtMinted(DebtMintedEvent event) {
        log.info("Debt minted: account={}, amount={}, healthFactor={}",
            event.getAccount(), event.getAmount(), event.getHealthFactor());
    }

    @EventListener
    public void onDebtBurned(DebtBurnedEvent event) {
        log.info("Debt burned: from={}, onBehalfOf={}, amount={}",
            event.getBurnedFrom(), event.getOnBehalfOf(), event.getAmount());
    }

    @EventListener
    public void onLiquidation(LiquidationExecutedEvent event) {
        log.warn("Liquidation executed: user={}, liquidator={}, asset={}, debtCovered={}, seized={}, bonus={}, healthFactor {} -> {}",
            event.getAccount(), event.getLiquidator(), event.getAssetId(), event.getDebtCovered(),
            event.getCollateralSeized(), event.getBonusCollateral(),
            event.getStartingHealthFactor(), event.getEndingHealthFactor());
    }
}
