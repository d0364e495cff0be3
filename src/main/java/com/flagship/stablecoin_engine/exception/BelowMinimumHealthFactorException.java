package com.flagship.stablecoin_engine.exception;

import java.math.BigInteger;
import java.util.Map;

/**
 * Post-mutation solvency check failed. Carries the computed health factor
 * (18-decimal fixed point) for diagnostics.
 */
public class BelowMinimumHealthFactorException extends StablecoinEngineException {

    private final BigInteger healthFactor;

    public BelowMinimumHealthFactorException(String account, BigInteger healthFactor) {
        super(ErrorCode.BELOW_MINIMUM_HEALTH_FACTOR,
                String.format("Health factor of %s is below minimum: %s", account, healthFactor));
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
