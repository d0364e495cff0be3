package com.flagship.stablecoin_engine.exception;

/**
 * Stable identifiers for every failure the engine can surface.
 * Clients branch on these (e.g. retry on STALE_PRICE, abandon on NOT_LIQUIDATABLE).
 */
public enum ErrorCode {
    INVALID_AMOUNT,
    ASSET_NOT_ALLOWED,
    CONFIGURATION_MISMATCH,
    TRANSFER_FAILED,
    INSUFFICIENT_BALANCE,
    MINT_FAILED,
    BELOW_MINIMUM_HEALTH_FACTOR,
    NOT_LIQUIDATABLE,
    HEALTH_FACTOR_NOT_IMPROVED,
    STALE_PRICE,
    REENTRANT_CALL
}
