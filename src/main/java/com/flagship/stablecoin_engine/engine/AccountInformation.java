package com.flagship.stablecoin_engine.engine;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Point-in-time view of one account, all values from the same ledger snapshot.
 */
@Value
@Builder
public class AccountInformation {
    String account;
    BigInteger totalDebtMinted;
    BigInteger collateralValueUsd;
    BigInteger healthFactor;
    BigInteger maxMintableUsd;
}
