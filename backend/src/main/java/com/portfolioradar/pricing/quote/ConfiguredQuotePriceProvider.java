package com.portfolioradar.pricing.quote;

import com.portfolioradar.domain.Asset;
import com.portfolioradar.pricing.MarketPriceProvider;
import com.portfolioradar.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Quotes from portfolioradar.pricing.quotes, for assets with no live feed.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class ConfiguredQuotePriceProvider implements MarketPriceProvider {

    private final PricingProperties pricingProperties;

    @Override
    public boolean supports(Asset asset) {
        return asset != null && asset.getSymbol() != null
                && pricingProperties.getQuotes().containsKey(asset.getSymbol());
    }

    @Override
    public Optional<BigDecimal> fetchPrice(Asset asset) {
        return Optional.ofNullable(pricingProperties.getQuotes().get(asset.getSymbol()))
                .filter(quote -> quote.signum() >= 0);
    }
}
