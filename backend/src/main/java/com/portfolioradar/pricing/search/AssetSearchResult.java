package com.portfolioradar.pricing.search;

import com.portfolioradar.domain.AssetCategory;

/**
 * One search hit, carrying the registry fields a caller passes on when it records the first transaction of the asset.
 */
public record AssetSearchResult(String symbol, String name, AssetCategory category, String apiSource, String apiId) {
}
