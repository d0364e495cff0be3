package com.flagship.stablecoin_engine.exception;

/**
 * A custody or debt-token transfer reported failure.
 */
public class TransferFailedException extends StablecoinEngineException {

    public TransferFailedException(String message) {
        super(ErrorCode.TRANSFER_FAILED, message);
    }
}
