package com.portfolioradar.pricing;

import com.portfolioradar.domain.PriceSource;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Result of historical price resolution: a price with its source, or unknown.
 */
@Getter
public class PriceResolutionResult {

    private static final PriceResolutionResult UNKNOWN = new PriceResolutionResult(null, null);

    private final BigDecimal priceUsd;
    private final PriceSource priceSource;

    private PriceResolutionResult(BigDecimal priceUsd, PriceSource priceSource) {
        this.priceUsd = priceUsd;
        this.priceSource = priceSource;
    }

    public static PriceResolutionResult known(BigDecimal priceUsd, PriceSource source) {
        if (priceUsd == null || source == null || priceUsd.signum() < 0) {
            return UNKNOWN;
        }
        return new PriceResolutionResult(priceUsd, source);
    }

    public static PriceResolutionResult unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return priceUsd == null;
    }

    public Optional<BigDecimal> getPriceUsd() {
        return Optional.ofNullable(priceUsd);
    }
}
