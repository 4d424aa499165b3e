package com.portfolioradar.portfolio;

import java.math.BigDecimal;

/**
 * Totals over all open holdings.
 */
public record PortfolioSummary(BigDecimal totalInvested, BigDecimal currentValue, BigDecimal totalPnl,
                               int holdingsCount) {

    public static final PortfolioSummary EMPTY =
            new PortfolioSummary(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0);
}
