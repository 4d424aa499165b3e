package com.portfolioradar.domain;

/**
 * Registry category, used for diversification breakdown.
 */
public enum AssetCategory {
    STOCKS,
    ETFS,
    CRYPTO,
    FIAT
}
