package com.flagship.stablecoin_engine.exception;

/**
 * A mutating entry point was invoked while the same thread already held the engine guard.
 */
public class ReentrantCallException extends StablecoinEngineException {

    public ReentrantCallException(String operation) {
        super(ErrorCode.REENTRANT_CALL, "Reentrant call rejected: " + operation);
    }
}
