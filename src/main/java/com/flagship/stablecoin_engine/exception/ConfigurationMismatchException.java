package com.flagship.stablecoin_engine.exception;

public class ConfigurationMismatchException extends StablecoinEngineException {

    public ConfigurationMismatchException(String message) {
        super(ErrorCode.CONFIGURATION_MISMATCH, message);
    }
}
