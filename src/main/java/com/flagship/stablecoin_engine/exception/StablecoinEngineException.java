package com.flagship.stablecoin_engine.exception;

import java.util.Map;

/**
 * Base type for all typed engine failures.
 *
 * Every subclass aborts the enclosing mutating operation as a whole:
 * the ledger transaction is discarded and nothing is published.
 */
public abstract class StablecoinEngineException extends RuntimeException {

    private final ErrorCode errorCode;

    protected StablecoinEngineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Machine-readable diagnostics attached to the error response.
     */
    public Map<String, String> getDetails() {
        return Map.of();
    }
}
