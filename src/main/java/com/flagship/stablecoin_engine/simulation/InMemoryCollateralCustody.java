package com.flagship.stablecoin_engine.simulation;

import com.flagship.stablecoin_engine.custody.CollateralCustody;
import com.flagship.stablecoin_engine.exception.InvalidAmountException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Collateral custody backed by in-memory wallets.
 *
 * Holds one external wallet per (asset, holder) plus the engine's custody
 * balance per asset. A transfer that the source cannot cover returns false.
 */
public class InMemoryCollateralCustody implements CollateralCustody {

    private final Map<String, Map<String, BigInteger>> wallets = new HashMap<>();
    private final Map<String, BigInteger> custody = new HashMap<>();

    @Override
    public synchronized boolean transferIn(String assetId, String from, BigInteger amount) {
        BigInteger available = balanceOf(assetId, from);
        if (amount.signum() <= 0 || available.compareTo(amount) < 0) {
            return false;
        }
        walletsOf(assetId).put(from, available.subtract(amount));
        custody.merge(assetId, amount, BigInteger::add);
        return true;
    }

    @Override
    public synchronized boolean transferOut(String assetId, String to, BigInteger amount) {
        BigInteger held = custodyBalance(assetId);
        if (amount.signum() <= 0 || held.compareTo(amount) < 0) {
            return false;
        }
        custody.put(assetId, held.subtract(amount));
        walletsOf(assetId).merge(to, amount, BigInteger::add);
        return true;
    }

    /**
     * Credits an external wallet out of thin air.
     */
    public synchronized void fund(String assetId, String holder, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("amount", amount);
        }
        walletsOf(assetId).merge(holder, amount, BigInteger::add);
    }

    public synchronized BigInteger balanceOf(String assetId, String holder) {
        return walletsOf(assetId).getOrDefault(holder, BigInteger.ZERO);
    }

    public synchronized BigInteger custodyBalance(String assetId) {
        return custody.getOrDefault(assetId, BigInteger.ZERO);
    }

    private Map<String, BigInteger> walletsOf(String assetId) {
        return wallets.computeIfAbsent(assetId, id -> new HashMap<>());
    }
}
