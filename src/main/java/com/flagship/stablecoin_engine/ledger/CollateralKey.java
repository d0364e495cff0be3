package com.flagship.stablecoin_engine.ledger;

import lombok.Value;

@Value
public class CollateralKey {
    String account;
    String assetId;
}
