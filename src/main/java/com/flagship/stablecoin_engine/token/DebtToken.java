package com.flagship.stablecoin_engine.token;

import java.math.BigInteger;

/**
 * The dollar-pegged debt token. The engine is its only minter and burner.
 */
public interface DebtToken {

    /**
     * @return false if the token refused to mint
     */
    boolean mint(String to, BigInteger amount);

    /**
     * Burns from the engine's own token balance.
     */
    void burn(BigInteger amount);

    /**
     * @return false if the transfer did not happen
     */
    boolean transferFrom(String from, String to, BigInteger amount);

    BigInteger balanceOf(String holder);
}
