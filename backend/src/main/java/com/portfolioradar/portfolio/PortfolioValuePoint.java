package com.portfolioradar.portfolio;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Sum of all assets' snapshots on one day.
 */
public record PortfolioValuePoint(LocalDate date, BigDecimal totalValue, BigDecimal unrealizedPnl) {
}
