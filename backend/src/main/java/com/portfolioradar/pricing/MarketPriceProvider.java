package com.portfolioradar.pricing;

import com.portfolioradar.domain.Asset;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * A live quote source for registry assets.
 */
public interface MarketPriceProvider {

    boolean supports(Asset asset);

    /**
     * @return the current price, empty when the source has no quote for the asset
     * @throws PriceUnavailableException when the source cannot be reached or answers with an error
     */
    Optional<BigDecimal> fetchPrice(Asset asset);
}
