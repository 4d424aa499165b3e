package com.portfolioradar.holdings.policy;

import java.math.BigDecimal;

/**
 * Average cost per unit and the capital attributed to the position. estimated is true when no fiat flow backs it.
 */
public record CostBasis(BigDecimal avgCost, BigDecimal invested, boolean estimated) {
}
