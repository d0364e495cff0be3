package com.flagship.stablecoin_engine.exception;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A debit asked for more than the recorded balance.
 */
public class InsufficientBalanceException extends StablecoinEngineException {

    private final BigInteger requested;
    private final BigInteger available;

    public InsufficientBalanceException(String ledger, String account, BigInteger requested, BigInteger available) {
        super(ErrorCode.INSUFFICIENT_BALANCE,
                String.format("Insufficient %s balance: account=%s, requested=%s, available=%s",
                        ledger, account, requested, available));
        this.requested = requested;
        this.available = available;
    }

    public BigInteger getRequested() {
        return requested;
    }

    public BigInteger getAvailable() {
        return available;
    }

    @Override
    public Map<String, String> getDetails() {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("requested", requested.toString());
        details.put("available", available.toString());
        return details;
    }
}
