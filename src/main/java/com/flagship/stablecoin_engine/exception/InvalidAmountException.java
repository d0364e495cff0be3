package com.flagship.stablecoin_engine.exception;

import java.math.BigInteger;

public class InvalidAmountException extends StablecoinEngineException {

    public InvalidAmountException(String field, BigInteger amount) {
        super(ErrorCode.INVALID_AMOUNT,
                String.format("%s must be greater than zero, got %s", field, amount));
    }
}
