package com.flagship.stablecoin_engine.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stablecoin_engine.engine.AccountInformation;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("account")
    String account;

    @JsonProperty("total_debt_minted")
    BigInteger totalDebtMinted;

    @JsonProperty("collateral_value_usd")
    BigInteger collateralValueUsd;

    @JsonProperty("health_factor")
    BigInteger healthFactor;

    @JsonProperty("max_mintable_usd")
    BigInteger maxMintableUsd;

    @JsonProperty("ledger_version")
    long ledgerVersion;

    public static AccountResponse from(AccountInformation info, long ledgerVersion) {
        return AccountResponse.builder()
            .account(info.getAccount())
            .totalDebtMinted(info.getTotalDebtMinted())
            .collateralValueUsd(info.getCollateralValueUsd())
            .healthFactor(info.getHealthFactor())
            .maxMintableUsd(info.getMaxMintableUsd())
            .ledgerVersion(ledgerVersion)
            .build();
    }
}
