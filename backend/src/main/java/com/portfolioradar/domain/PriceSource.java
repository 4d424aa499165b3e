package com.portfolioradar.domain;

/**
 * Where a historical price came from. Priority when building snapshots: MANUAL &gt; COINGECKO &gt; ESTIMATED.
 */
public enum PriceSource {
    MANUAL,
    COINGECKO,
    ESTIMATED
}
