package com.flagship.stablecoin_engine.ledger;

import com.flagship.stablecoin_engine.event.LedgerChangedEvent;
import com.flagship.stablecoin_engine.exception.InsufficientBalanceException;
import com.flagship.stablecoin_engine.exception.InvalidAmountException;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;

/**
 * Per-account minted debt, 18-decimal units where 10^18 equals one dollar.
 */
@RequiredArgsConstructor
public class DebtLedger {

    private final LedgerStore store;

    public void creditDebt(String account, BigInteger amount) {
        requirePositive(amount);
        LedgerTransaction tx = store.currentTransaction();
        tx.putDebt(account, tx.debtOf(account).add(amount));
        tx.record(LedgerChangedEvent.debt(account, amount, EntryType.CREDIT));
    }

    public void debitDebt(String account, BigInteger amount) {
        requirePositive(amount);
        LedgerTransaction tx = store.currentTransaction();
        BigInteger balance = tx.debtOf(account);
        if (amount.compareTo(balance) > 0) {
            throw new InsufficientBalanceException("debt", account, amount, balance);
        }
        tx.putDebt(account, balance.subtract(amount));
        tx.record(LedgerChangedEvent.debt(account, amount, EntryType.DEBIT));
    }

    public BigInteger balance(String account) {
        return store.view().debtOf(account);
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("amount", amount);
        }
    }
}
