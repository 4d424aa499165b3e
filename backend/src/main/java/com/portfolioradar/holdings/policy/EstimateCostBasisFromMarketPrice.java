package com.portfolioradar.holdings.policy;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * avgCost = current market price, invested = quantity * avgCost. The basis moves with the market even when the
 * ledger does not change, so unrealized P&amp;L of such positions is always 0 at projection time.
 */
@Component
public class EstimateCostBasisFromMarketPrice implements CostBasisFallbackPolicy {

    private static final int SCALE = 18;

    @Override
    public CostBasis resolve(BigDecimal quantity, BigDecimal netInvestedFiat, BigDecimal marketPrice) {
        BigDecimal price = marketPrice != null ? marketPrice : BigDecimal.ZERO;
        return new CostBasis(price, quantity.multiply(price).setScale(SCALE, RoundingMode.HALF_UP), true);
    }
}
