package com.flagship.stablecoin_engine.simulation;

import com.flagship.stablecoin_engine.token.DebtToken;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Debt token ledger kept in memory. Burns come out of the owner's balance,
 * the owner being the engine's custody address.
 */
@RequiredArgsConstructor
public class InMemoryDebtToken implements DebtToken {

    private final String owner;
    private final Map<String, BigInteger> balances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    @Override
    public synchronized boolean mint(String to, BigInteger amount) {
        if (amount.signum() <= 0) {
            return false;
        }
        balances.merge(to, amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
        return true;
    }

    /**
     * @throws IllegalStateException if the owner holds less than {@code amount}
     */
    @Override
    public synchronized void burn(BigInteger amount) {
        BigInteger held = balanceOf(owner);
        if (amount.signum() <= 0 || held.compareTo(amount) < 0) {
            throw new IllegalStateException("Cannot burn " + amount + ", owner holds " + held);
        }
        balances.put(owner, held.subtract(amount));
        totalSupply = totalSupply.subtract(amount);
    }

    @Override
    public synchronized boolean transferFrom(String from, String to, BigInteger amount) {
        BigInteger available = balanceOf(from);
        if (amount.signum() <= 0 || available.compareTo(amount) < 0) {
            return false;
        }
        balances.put(from, available.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        return true;
    }

    @Override
    public synchronized BigInteger balanceOf(String holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }
}
