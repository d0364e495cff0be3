package com.flagship.stablecoin_engine.exception;

import java.math.BigInteger;
import java.util.Map;

public class NotLiquidatableException extends StablecoinEngineException {

    private final BigInteger healthFactor;

    public NotLiquidatableException(String account, BigInteger healthFactor) {
        super(ErrorCode.NOT_LIQUIDATABLE,
                String.format("Account %s is healthy (health factor %s) and cannot be liquidated", account, healthFactor));
        this.healthFactor = healthFactor;
    }

    public BigInteger getHealthFactor() {
        return healthFactor;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of("health_factor", healthFactor.toString());
    }
}
