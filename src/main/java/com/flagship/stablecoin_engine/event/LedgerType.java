package com.flagship.stablecoin_engine.event;

public enum LedgerType {
    COLLATERAL,
    DEBT
}
