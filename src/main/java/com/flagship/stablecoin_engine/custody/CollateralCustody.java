package com.flagship.stablecoin_engine.custody;

import java.math.BigInteger;

/**
 * Physical movement of collateral between holders and engine custody.
 *
 * Accounting of who owns what lives in the collateral ledger; this capability
 * only moves the assets and reports whether the move happened.
 */
public interface CollateralCustody {

    /**
     * Moves {@code amount} of {@code assetId} from {@code from} into engine custody.
     *
     * @return false if the transfer did not happen
     */
    boolean transferIn(String assetId, String from, BigInteger amount);

    /**
     * Moves {@code amount} of {@code assetId} out of engine custody to {@code to}.
     *
     * @return false if the transfer did not happen
     */
    boolean transferOut(String assetId, String to, BigInteger amount);
}
