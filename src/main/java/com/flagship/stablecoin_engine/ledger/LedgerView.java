package com.flagship.stablecoin_engine.ledger;

import java.math.BigInteger;

/**
 * Read access to collateral and debt balances. Missing entries read as zero.
 */
public interface LedgerView {

    BigInteger collateralOf(String account, String assetId);

    BigInteger debtOf(String account);
}
