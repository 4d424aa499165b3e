package com.portfolioradar.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Pure reductions over ledger legs shared by holdings projection and historical replay.
 * <ul>
 *   <li>quantity: +q for BUY / TRADE_IN, -q for SELL / TRADE_OUT</li>
 *   <li>fiat flow: +(total + fees) for BUY, -(total - fees) for SELL, 0 for trade legs</li>
 * </ul>
 */
public final class LedgerFolds {

    /** Replay order: occurredAt, then insertion time. */
    public static final Comparator<TransactionRecord> REPLAY_ORDER = Comparator
            .comparing(TransactionRecord::getOccurredAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(TransactionRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private LedgerFolds() {
    }

    public static BigDecimal signedQuantity(TransactionRecord r) {
        BigDecimal q = nz(r.getQuantity());
        return switch (r.getKind()) {
            case BUY, TRADE_IN -> q;
            case SELL, TRADE_OUT -> q.negate();
        };
    }

    public static BigDecimal fiatFlow(TransactionRecord r) {
        return switch (r.getKind()) {
            case BUY -> nz(r.getTotalAmount()).add(nz(r.getFees()));
            case SELL -> nz(r.getTotalAmount()).subtract(nz(r.getFees())).negate();
            case TRADE_IN, TRADE_OUT -> BigDecimal.ZERO;
        };
    }

    /** Fiat flow counting inflow legs only; sells are not netted out. */
    public static BigDecimal inflowFiat(TransactionRecord r) {
        return switch (r.getKind()) {
            case BUY, TRADE_IN -> fiatFlow(r);
            case SELL, TRADE_OUT -> BigDecimal.ZERO;
        };
    }

    public static PositionTotals fold(Collection<TransactionRecord> records) {
        return records.stream()
                .map(r -> new PositionTotals(signedQuantity(r), fiatFlow(r)))
                .reduce(PositionTotals.ZERO, PositionTotals::plus);
    }

    public static BigDecimal sumInflowFiat(Collection<TransactionRecord> records) {
        return records.stream()
                .map(LedgerFolds::inflowFiat)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Legs whose calendar day in {@code zone} is on or before {@code asOfDate}. Undated legs are excluded. */
    public static List<TransactionRecord> upToDate(Collection<TransactionRecord> records, LocalDate asOfDate, ZoneId zone) {
        return records.stream()
                .filter(r -> r.getOccurredAt() != null)
                .filter(r -> !r.getOccurredAt().atZone(zone).toLocalDate().isAfter(asOfDate))
                .sorted(REPLAY_ORDER)
                .toList();
    }

    public static List<TransactionRecord> inReplayOrder(Collection<TransactionRecord> records) {
        return records.stream().sorted(REPLAY_ORDER).toList();
    }

    private static BigDecimal nz(BigDecimal v) {
        return v != null ? v : BigDecimal.ZERO;
    }
}
