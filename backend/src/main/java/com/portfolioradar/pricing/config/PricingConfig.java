package com.portfolioradar.pricing.config;

import com.portfolioradar.common.RateLimiter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pricing module configuration: properties and the shared CoinGecko rate limiter.
 */
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    public static final String COINGECKO_RATE_LIMITER = "coingeckoRateLimiter";

    @Bean(name = COINGECKO_RATE_LIMITER)
    public RateLimiter coingeckoRateLimiter(PricingProperties pricingProperties) {
        return RateLimiter.perMinute(pricingProperties.getCoingeckoRequestsPerMinute());
    }
}
