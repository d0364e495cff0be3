package com.flagship.stablecoin_engine.exception;

public class MintFailedException extends StablecoinEngineException {

    public MintFailedException(String message) {
        super(ErrorCode.MINT_FAILED, message);
    }
}
