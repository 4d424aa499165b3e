package com.portfolioradar.snapshot;

import java.time.LocalDate;

/**
 * A failed backfill cell; date is null when the whole asset failed before any cell was attempted.
 */
public record BackfillError(String assetSymbol, LocalDate date, String message) {
}
