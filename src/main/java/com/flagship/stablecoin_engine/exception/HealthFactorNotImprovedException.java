package com.flagship.stablecoin_engine.exception;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

public class HealthFactorNotImprovedException extends StablecoinEngineException {

    private final BigInteger startingHealthFactor;
    private final BigInteger endingHealthFactor;

    public HealthFactorNotImprovedException(String account, BigInteger startingHealthFactor, BigInteger endingHealthFactor) {
        super(ErrorCode.HEALTH_FACTOR_NOT_IMPROVED,
                String.format("Liquidation did not improve health factor of %s: start=%s, end=%s",
                        account, startingHealthFactor, endingHealthFactor));
        this.startingHealthFactor = startingHealthFactor;
        this.endingHealthFactor = endingHealthFactor;
    }

    public BigInteger getStartingHealthFactor() {
        return startingHealthFactor;
    }

    public BigInteger getEndingHealthFactor() {
        return endingHealthFactor;
    }

    @Override
    public Map<String, String> getDetails() {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("starting_health_factor", startingHealthFactor.toString());
        details.put("ending_health_factor", endingHealthFactor.toString());
        return details;
    }
}
