package com.flagship.stablecoin_engine.position;

import com.flagship.stablecoin_engine.asset.AssetRegistry;
import com.flagship.stablecoin_engine.custody.CollateralCustody;
import com.flagship.stablecoin_engine.event.CollateralDepositedEvent;
import com.flagship.stablecoin_engine.event.CollateralRedeemedEvent;
import com.flagship.stablecoin_engine.event.DebtBurnedEvent;
import com.flagship.stablecoin_engine.event.DebtMintedEvent;
import com.flagship.stablecoin_engine.exception.InsufficientBalanceException;
import com.flagship.stablecoin_engine.exception.InvalidAmountException;
import com.flagship.stablecoin_engine.exception.MintFailedException;
import com.flagship.stablecoin_engine.exception.TransferFailedException;
import com.flagship.stablecoin_engine.ledger.CollateralLedger;
import com.flagship.stablecoin_engine.ledger.DebtLedger;
import com.flagship.stablecoin_engine.ledger.LedgerStore;
import com.flagship.stablecoin_engine.ledger.LedgerTransaction;
import com.flagship.stablecoin_engine.solvency.SolvencyCalculator;
import com.flagship.stablecoin_engine.token.DebtToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Deposit, mint, redeem and burn against a single account.
 *
 * Every method must run inside a ledger transaction (see
 * {@code EngineTransactionTemplate}); a failure anywhere discards all ledger
 * writes of the enclosing operation. External transfers that already
 * happened register a compensating transfer on the transaction.
 */
@Slf4j
@RequiredArgsConstructor
public class PositionManager {

    private final AssetRegistry registry;
    private final CollateralLedger collateralLedger;
    private final DebtLedger debtLedger;
    private final SolvencyCalculator solvency;
    private final CollateralCustody custody;
    private final DebtToken debtToken;
    private final LedgerStore ledgerStore;
    private final String engineAddress;

    public void depositCollateral(String account, String assetId, BigInteger amount) {
        requirePositive("amount", amount);
        registry.require(assetId);

        collateralLedger.credit(account, assetId, amount);
        LedgerTransaction tx = ledgerStore.currentTransaction();
        tx.record(CollateralDepositedEvent.of(account, assetId, amount));

        if (!custody.transferIn(assetId, account, amount)) {
            throw new TransferFailedException(
                String.format("Collateral transfer in failed: asset=%s, from=%s, amount=%s", assetId, account, amount));
        }
        tx.onRollback("return " + amount + " " + assetId + " to " + account,
            () -> custody.transferOut(assetId, account, amount));
    }

    /**
     * Records the debt first and checks solvency against it; the token is minted only if the check passes.
     */
    public void mintDebt(String account, BigInteger amount) {
        requirePositive("amount", amount);

        debtLedger.creditDebt(account, amount);
        solvency.assertHealthy(account);

        if (!debtToken.mint(account, amount)) {
            throw new MintFailedException(
                String.format("Debt token mint failed: to=%s, amount=%s", account, amount));
        }
        LedgerTransaction tx = ledgerStore.currentTransaction();
        tx.onRollback("reclaim " + amount + " minted to " + account, () -> {
            if (!debtToken.transferFrom(account, engineAddress, amount)) {
                return false;
            }
            debtToken.burn(amount);
            return true;
        });
        tx.record(DebtMintedEvent.of(account, amount, solvency.healthFactor(account)));
    }

    public void redeemCollateral(String account, String assetId, BigInteger amount) {
        requirePositive("amount", amount);
        registry.require(assetId);

        redeem(account, account, assetId, amount);
        solvency.assertHealthy(account);
    }

    public void burnDebt(String account, BigInteger amount) {
        repayDebt(account, amount);
        solvency.assertHealthy(account);
    }

    /**
     * Burns the account's own debt with no health check. Composite flows check once at the end.
     */
    public void repayDebt(String account, BigInteger amount) {
        requirePositive("amount", amount);
        burn(account, account, amount);
    }

    /**
     * Moves collateral out of {@code redeemFrom}'s ledger entry and custody to {@code redeemTo}.
     * When the two differ the collateral is re-credited to {@code redeemTo} so the ledger
     * keeps accounting for every unit.
     */
    public void redeem(String redeemFrom, String redeemTo, String assetId, BigInteger amount) {
        collateralLedger.debit(redeemFrom, assetId, amount);
        LedgerTransaction tx = ledgerStore.currentTransaction();
        tx.record(CollateralRedeemedEvent.of(redeemFrom, redeemTo, assetId, amount));

        if (!custody.transferOut(assetId, redeemTo, amount)) {
            throw new TransferFailedException(
                String.format("Collateral transfer out failed: asset=%s, to=%s, amount=%s", assetId, redeemTo, amount));
        }
        tx.onRollback("recover " + amount + " " + assetId + " from " + redeemTo,
            () -> custody.transferIn(assetId, redeemTo, amount));

        if (!redeemFrom.equals(redeemTo)) {
            collateralLedger.credit(redeemTo, assetId, amount);
        }
    }

    /**
     * Repays {@code onBehalfOf}'s debt with tokens pulled from {@code burnFrom}. When the two
     * differ, {@code burnFrom}'s own debt record is reduced by the same amount.
     */
    public void burn(String burnFrom, String onBehalfOf, BigInteger amount) {
        BigInteger owed = debtLedger.balance(onBehalfOf);
        if (owed.compareTo(amount) < 0) {
            throw new InsufficientBalanceException("debt", onBehalfOf, amount, owed);
        }
        debtLedger.debitDebt(onBehalfOf, amount);

        LedgerTransaction tx = ledgerStore.currentTransaction();
        if (!debtToken.transferFrom(burnFrom, engineAddress, amount)) {
            throw new TransferFailedException(
                String.format("Debt token transfer failed: from=%s, amount=%s", burnFrom, amount));
        }
        tx.onRollback("return " + amount + " debt tokens to " + burnFrom,
            () -> debtToken.transferFrom(engineAddress, burnFrom, amount));

        if (!burnFrom.equals(onBehalfOf)) {
            debtLedger.debitDebt(burnFrom, amount);
        }

        debtToken.burn(amount);
        tx.onRollback("re-mint " + amount + " burned debt tokens", () -> debtToken.mint(engineAddress, amount));
        tx.record(DebtBurnedEvent.of(burnFrom, onBehalfOf, amount));
    }

    static void requirePositive(String field, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException(field, amount);
        }
    }
}
