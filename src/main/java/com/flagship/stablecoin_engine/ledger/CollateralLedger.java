package com.flagship.stablecoin_engine.ledger;

import com.flagship.stablecoin_engine.event.LedgerChangedEvent;
import com.flagship.stablecoin_engine.exception.InsufficientBalanceException;
import com.flagship.stablecoin_engine.exception.InvalidAmountException;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;

/**
 * Per-account, per-asset collateral balances in the asset's smallest unit.
 *
 * Invariant: a balance is never negative. A debit larger than the recorded
 * balance is rejected before anything is written.
 */
@RequiredArgsConstructor
public class CollateralLedger {

    private final LedgerStore store;

    public void credit(String account, String assetId, BigInteger amount) {
        requirePositive(amount);
        LedgerTransaction tx = store.currentTransaction();
        tx.putCollateral(account, assetId, tx.collateralOf(account, assetId).add(amount));
        tx.record(LedgerChangedEvent.collateral(account, assetId, amount, EntryType.CREDIT));
    }

    public void debit(String account, String assetId, BigInteger amount) {
        requirePositive(amount);
        LedgerTransaction tx = store.currentTransaction();
        BigInteger balance = tx.collateralOf(account, assetId);
        if (amount.compareTo(balance) > 0) {
            throw new InsufficientBalanceException("collateral " + assetId, account, amount, balance);
        }
        tx.putCollateral(account, assetId, balance.subtract(amount));
        tx.record(LedgerChangedEvent.collateral(account, assetId, amount, EntryType.DEBIT));
    }

    public BigInteger balance(String account, String assetId) {
        return store.view().collateralOf(account, assetId);
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("amount", amount);
        }
    }
}
