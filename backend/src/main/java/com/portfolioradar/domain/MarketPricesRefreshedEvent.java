package com.portfolioradar.domain;

import java.util.Set;

/**
 * Application event: registry prices changed for these assets. Published by pricing; consumed by holdings.
 */
public record MarketPricesRefreshedEvent(Set<String> assetSymbols) {

    public MarketPricesRefreshedEvent {
        assetSymbols = Set.copyOf(assetSymbols);
    }
}
