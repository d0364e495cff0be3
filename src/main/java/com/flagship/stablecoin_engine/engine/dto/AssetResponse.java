package com.flagship.stablecoin_engine.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.stablecoin_engine.asset.CollateralAsset;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AssetResponse {

    @JsonProperty("asset_id")
    String assetId;

    @JsonProperty("price_feed_id")
    String priceFeedId;

    public static AssetResponse from(CollateralAsset asset) {
        return AssetResponse.builder()
            .assetId(asset.getAssetId())
            .priceFeedId(asset.getPriceFeedId())
            .build();
    }
}
