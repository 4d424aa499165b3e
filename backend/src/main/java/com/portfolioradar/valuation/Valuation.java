package com.portfolioradar.valuation;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Point-in-time valuation of one asset. All fields are non-null; an asset not yet held has zero quantity, value
 * and P&amp;L.
 */
public record Valuation(
        String assetSymbol,
        LocalDate asOfDate,
        BigDecimal quantity,
        BigDecimal pricePerUnit,
        BigDecimal investedToDate,
        BigDecimal totalValue,
        BigDecimal unrealizedPnl
) {

    public boolean isEmptyPosition() {
        return quantity.signum() == 0;
    }
}
