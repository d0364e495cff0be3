package com.flagship.stablecoin_engine.exception;

import java.util.Map;

public class AssetNotAllowedException extends StablecoinEngineException {

    private final String assetId;

    public AssetNotAllowedException(String assetId) {
        super(ErrorCode.ASSET_NOT_ALLOWED, "Collateral asset is not allowed: " + assetId);
        this.assetId = assetId;
    }

    public String getAssetId() {
        return assetId;
    }

    @Override
    public Map<String, String> getDetails() {
        return Map.of("asset_id", String.valueOf(assetId));
    }
}
