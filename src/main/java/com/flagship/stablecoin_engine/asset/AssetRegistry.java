package com.flagship.stablecoin_engine.asset;

import com.flagship.stablecoin_engine.exception.AssetNotAllowedException;
import com.flagship.stablecoin_engine.exception.ConfigurationMismatchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, ordered allow-list of collateral assets.
 *
 * Built once at construction. Valuation iterates {@link #getAssets()} in
 * registration order, so results never depend on map ordering.
 */
public final class AssetRegistry {

    private final List<CollateralAsset> assets;
    private final Map<String, CollateralAsset> byAssetId;

    private AssetRegistry(List<CollateralAsset> assets) {
        this.assets = Collections.unmodifiableList(assets);
        Map<String, CollateralAsset> index = new LinkedHashMap<>();
        for (CollateralAsset asset : assets) {
            index.put(asset.getAssetId(), asset);
        }
        this.byAssetId = Collections.unmodifiableMap(index);
    }

    /**
     * Pairs asset ids with price feed ids by position.
     *
     * @throws ConfigurationMismatchException if the lists differ in length,
     *         contain blanks, or repeat an asset id
     */
    public static AssetRegistry of(List<String> assetIds, List<String> priceFeedIds) {
        if (assetIds == null || priceFeedIds == null || assetIds.size() != priceFeedIds.size()) {
            throw new ConfigurationMismatchException(String.format(
                "Asset ids and price feed ids must have the same length: assets=%s, feeds=%s",
                assetIds == null ? null : assetIds.size(),
                priceFeedIds == null ? null : priceFeedIds.size()));
        }

        List<CollateralAsset> assets = new ArrayList<>(assetIds.size());
        for (int i = 0; i < assetIds.size(); i++) {
            String assetId = assetIds.get(i);
            String priceFeedId = priceFeedIds.get(i);
            if (assetId == null || assetId.isBlank() || priceFeedId == null || priceFeedId.isBlank()) {
                throw new ConfigurationMismatchException("Blank asset or price feed id at position " + i);
            }
            for (CollateralAsset existing : assets) {
                if (existing.getAssetId().equals(assetId)) {
                    throw new ConfigurationMismatchException("Duplicate collateral asset: " + assetId);
                }
            }
            assets.add(new CollateralAsset(assetId, priceFeedId));
        }
        return new AssetRegistry(assets);
    }

    public List<CollateralAsset> getAssets() {
        return assets;
    }

    public CollateralAsset require(String assetId) {
        CollateralAsset asset = assetId == null ? null : byAssetId.get(assetId);
        if (asset == null) {
            throw new AssetNotAllowedException(assetId);
        }
        return asset;
    }

    public String priceFeedOf(String assetId) {
        return require(assetId).getPriceFeedId();
    }
}
