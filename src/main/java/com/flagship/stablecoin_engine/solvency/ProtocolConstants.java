package com.flagship.stablecoin_engine.solvency;

import java.math.BigInteger;

/**
 * Fixed-point scales and risk parameters.
 * <p>
 * Ledger amounts and USD values carry 18 decimals; feed answers carry 8.
 * {@link #ADDITIONAL_FEED_PRECISION} is the only bridge between the two.
 */
public final class ProtocolConstants {

    /** 10^18, the ledger scale and a health factor of exactly 1.0 */
    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);

    public static final int FEED_DECIMALS = 8;

    /** Lifts an 8-decimal feed answer to 18 decimals */
    public static final BigInteger ADDITIONAL_FEED_PRECISION = BigInteger.TEN.pow(18 - FEED_DECIMALS);

    /** Share of collateral value, in percent, that counts toward solvency (200% overcollateralized) */
    public static final BigInteger LIQUIDATION_THRESHOLD = BigInteger.valueOf(50);

    /** Extra collateral, in percent, paid to a liquidator */
    public static final BigInteger LIQUIDATION_BONUS = BigInteger.valueOf(10);

    public static final BigInteger LIQUIDATION_PRECISION = BigInteger.valueOf(100);

    public static final BigInteger MIN_HEALTH_FACTOR = PRECISION;

    /** 2^256 - 1, the health factor of an account without debt */
    public static final BigInteger MAX_HEALTH_FACTOR = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private ProtocolConstants() {
    }
}
