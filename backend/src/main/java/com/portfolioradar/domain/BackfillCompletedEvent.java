package com.portfolioradar.domain;

import java.time.LocalDate;
import java.util.Set;

/**
 * Application event: a snapshot backfill run finished. Published by snapshot; read caches over daily_snapshots
 * listen for it.
 */
public record BackfillCompletedEvent(Set<String> assetSymbols, LocalDate from, LocalDate to,
                                     int created, int skipped, int errors) {

    public BackfillCompletedEvent {
        assetSymbols = Set.copyOf(assetSymbols);
    }
}
