package com.flagship.stablecoin_engine.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Acknowledges a committed mutating operation.
 */
@Value
public class OperationResponse {

    @JsonProperty("operation")
    String operation;

    @JsonProperty("account")
    String account;

    @JsonProperty("ledger_version")
    long ledgerVersion;
}
