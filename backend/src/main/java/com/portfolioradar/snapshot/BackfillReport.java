package com.portfolioradar.snapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a backfill run. created + skipped + errors with a date = cells visited.
 */
public record BackfillReport(int created, int skipped, List<BackfillError> errors) {

    public static final BackfillReport EMPTY = new BackfillReport(0, 0, List.of());

    public BackfillReport {
        errors = List.copyOf(errors);
    }

    public BackfillReport plus(BackfillReport other) {
        List<BackfillError> all = new ArrayList<>(errors);
        all.addAll(other.errors);
        return new BackfillReport(created + other.created, skipped + other.skipped, all);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
