package com.portfolioradar.pricing.quote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolioradar.common.RateLimiter;
import com.portfolioradar.domain.Asset;
import com.portfolioradar.pricing.MarketPriceProvider;
import com.portfolioradar.pricing.PriceUnavailableException;
import com.portfolioradar.pricing.config.PricingConfig;
import com.portfolioradar.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Optional;

/**
 * Current USD price via CoinGecko /simple/price for assets registered with apiSource "coingecko".
 * Cached in spotPriceCache (5 min TTL) keyed by coin id.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class CoinGeckoSpotPriceProvider implements MarketPriceProvider {

    public static final String SOURCE = "coingecko";
    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    @Qualifier(PricingConfig.COINGECKO_RATE_LIMITER)
    private final RateLimiter rateLimiter;

    @Override
    public boolean supports(Asset asset) {
        return asset != null && SOURCE.equalsIgnoreCase(asset.getApiSource())
                && asset.getApiId() != null && !asset.getApiId().isBlank();
    }

    @Override
    @Cacheable(cacheNames = "spotPriceCache", key = "#asset.apiId", unless = "#result == null")
    public Optional<BigDecimal> fetchPrice(Asset asset) {
        String coinId = asset.getApiId().strip().toLowerCase();
        String url = pricingProperties.getCoingeckoBaseUrl() + "/simple/price?ids=" + coinId + "&vs_currencies=usd";
        rateLimiter.acquire();
        String response;
        try {
            response = webClientBuilder.build()
                    .get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(pricingProperties.getRequestTimeoutSeconds()));
        } catch (WebClientResponseException e) {
            throw new PriceUnavailableException("CoinGecko spot price failed for " + coinId + ": " + e.getStatusCode(), e);
        } catch (RuntimeException e) {
            throw new PriceUnavailableException("CoinGecko spot price error for " + coinId, e);
        }
        return parseUsdPrice(response, coinId);
    }

    static Optional<BigDecimal> parseUsdPrice(String json, String coinId) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode usd = MAPPER.readTree(json).path(coinId).path("usd");
            if (usd.isMissingNode() || !usd.isNumber()) {
                return Optional.empty();
            }
            return Optional.of(usd.decimalValue().setScale(SCALE, ROUNDING));
        } catch (Exception e) {
            log.debug("Unparseable CoinGecko payload for {}", coinId, e);
            return Optional.empty();
        }
    }
}
