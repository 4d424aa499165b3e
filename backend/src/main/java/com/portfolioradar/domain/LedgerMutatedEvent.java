package com.portfolioradar.domain;

import java.util.Set;

/**
 * Application event: the ledger changed for these assets. Published by ledger; consumed synchronously by holdings.
 */
public record LedgerMutatedEvent(Set<String> assetSymbols) {

    public LedgerMutatedEvent {
        assetSymbols = Set.copyOf(assetSymbols);
    }
}
