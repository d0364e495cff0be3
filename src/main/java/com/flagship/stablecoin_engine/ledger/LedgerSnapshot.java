package com.flagship.stablecoin_engine.ledger;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable, committed ledger state.
 *
 * Each successful mutating operation produces a new snapshot with a higher
 * version; readers holding an older snapshot keep a consistent view.
 */
public final class LedgerSnapshot implements LedgerView {

    static final LedgerSnapshot EMPTY = new LedgerSnapshot(0, Map.of(), Map.of());

    private final long version;
    private final Map<CollateralKey, BigInteger> collateral;
    private final Map<String, BigInteger> debt;

    private LedgerSnapshot(long version, Map<CollateralKey, BigInteger> collateral, Map<String, BigInteger> debt) {
        this.version = version;
        this.collateral = collateral;
        this.debt = debt;
    }

    public long getVersion() {
        return version;
    }

    @Override
    public BigInteger collateralOf(String account, String assetId) {
        return collateral.getOrDefault(new CollateralKey(account, assetId), BigInteger.ZERO);
    }

    @Override
    public BigInteger debtOf(String account) {
        return debt.getOrDefault(account, BigInteger.ZERO);
    }

    LedgerSnapshot apply(Map<CollateralKey, BigInteger> collateralWrites, Map<String, BigInteger> debtWrites) {
        if (collateralWrites.isEmpty() && debtWrites.isEmpty()) {
            return this;
        }
        Map<CollateralKey, BigInteger> nextCollateral = new HashMap<>(collateral);
        nextCollateral.putAll(collateralWrites);
        Map<String, BigInteger> nextDebt = new HashMap<>(debt);
        nextDebt.putAll(debtWrites);
        return new LedgerSnapshot(version + 1,
            Collections.unmodifiableMap(nextCollateral),
            Collections.unmodifiableMap(nextDebt));
    }
}
