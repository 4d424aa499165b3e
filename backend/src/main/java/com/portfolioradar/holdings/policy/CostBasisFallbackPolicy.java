package com.portfolioradar.holdings.policy;

import java.math.BigDecimal;

/**
 * Cost basis for a position whose net fiat flow is zero or negative, e.g. one built entirely from trade legs.
 */
public interface CostBasisFallbackPolicy {

    /**
     * @param quantity        clamped net quantity, always positive here
     * @param netInvestedFiat net fiat flow, zero or negative
     * @param marketPrice     latest known market price, 0 when unknown
     */
    CostBasis resolve(BigDecimal quantity, BigDecimal netInvestedFiat, BigDecimal marketPrice);
}
