package com.portfolioradar.domain;

import java.math.BigDecimal;

/**
 * Result of folding a ledger slice: raw signed quantity (may be negative for incomplete history) and net fiat flow.
 */
public record PositionTotals(BigDecimal netQuantity, BigDecimal netInvestedFiat) {

    public static final PositionTotals ZERO = new PositionTotals(BigDecimal.ZERO, BigDecimal.ZERO);

    public PositionTotals plus(PositionTotals other) {
        return new PositionTotals(netQuantity.add(other.netQuantity), netInvestedFiat.add(other.netInvestedFiat));
    }

    /** Quantity held, never negative. */
    public BigDecimal clampedQuantity() {
        return netQuantity.max(BigDecimal.ZERO);
    }

    public boolean hasPosition() {
        return netQuantity.signum() > 0;
    }
}
