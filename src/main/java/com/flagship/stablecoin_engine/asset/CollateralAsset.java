package com.flagship.stablecoin_engine.asset;

import lombok.Value;

/**
 * An allow-listed collateral asset and the price feed that values it.
 */
@Value
public class CollateralAsset {
    String assetId;
    String priceFeedId;
}
