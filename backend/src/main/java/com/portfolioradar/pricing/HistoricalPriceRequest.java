package com.portfolioradar.pricing;

import com.portfolioradar.domain.Asset;

import java.time.LocalDate;

/**
 * Price of one asset on one calendar day. coinGeckoId is null for assets not quoted by CoinGecko.
 */
public record HistoricalPriceRequest(String assetSymbol, String coinGeckoId, LocalDate date) {

    public static HistoricalPriceRequest forAsset(Asset asset, LocalDate date) {
        String coinId = asset.getApiSource() != null && asset.getApiSource().equalsIgnoreCase("coingecko")
                ? asset.getApiId()
                : null;
        return new HistoricalPriceRequest(asset.getSymbol(), coinId, date);
    }
}
