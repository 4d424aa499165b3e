package com.portfolioradar.pricing.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolioradar.common.RateLimiter;
import com.portfolioradar.domain.PriceHistoryEntry;
import com.portfolioradar.domain.PriceHistoryRepository;
import com.portfolioradar.domain.PriceSource;
import com.portfolioradar.pricing.HistoricalPriceRequest;
import com.portfolioradar.pricing.PriceResolutionResult;
import com.portfolioradar.pricing.config.PricingConfig;
import com.portfolioradar.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Resolves a historical USD price via CoinGecko /coins/{id}/history and stores hits in price_history so the next
 * backfill reads them locally. Disabled unless portfolioradar.pricing.historical-lookup-enabled is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CoinGeckoHistoricalResolver {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    // CoinGecko expects dd-MM-yyyy
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd-MM-yyyy");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    @Qualifier(PricingConfig.COINGECKO_RATE_LIMITER)
    private final RateLimiter rateLimiter;
    private final PriceHistoryRepository priceHistoryRepository;

    @Cacheable(cacheNames = "historicalPriceCache", key = "#request.coinGeckoId() + '-' + #request.date()",
            condition = "#request != null && #request.coinGeckoId() != null && #request.date() != null",
            unless = "#result.unknown")
    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        if (!pricingProperties.isHistoricalLookupEnabled() || request == null || request.date() == null) {
            return PriceResolutionResult.unknown();
        }
        String coinId = request.coinGeckoId();
        if (coinId == null || coinId.isBlank()) {
            return PriceResolutionResult.unknown();
        }
        rateLimiter.acquire();
        String dateStr = request.date().format(DATE_FORMAT);
        String url = pricingProperties.getCoingeckoBaseUrl() + "/coins/" + coinId.strip().toLowerCase()
                + "/history?date=" + dateStr + "&localization=false";
        String response;
        try {
            response = webClientBuilder.build()
                    .get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(pricingProperties.getRequestTimeoutSeconds()));
        } catch (WebClientResponseException e) {
            log.warn("CoinGecko history failed for {} date {}: {}", coinId, dateStr, e.getMessage());
            return PriceResolutionResult.unknown();
        } catch (RuntimeException e) {
            log.warn("CoinGecko history error for {} date {}", coinId, dateStr, e);
            return PriceResolutionResult.unknown();
        }
        Optional<BigDecimal> price = parseUsdPrice(response);
        price.ifPresent(p -> remember(request, p));
        return price.map(p -> PriceResolutionResult.known(p, PriceSource.COINGECKO))
                .orElse(PriceResolutionResult.unknown());
    }

    private void remember(HistoricalPriceRequest request, BigDecimal price) {
        PriceHistoryEntry entry = new PriceHistoryEntry();
        entry.setAssetSymbol(request.assetSymbol());
        entry.setPriceDate(request.date());
        entry.setPrice(price);
        entry.setSource(PriceSource.COINGECKO);
        entry.setRecordedAt(Instant.now());
        try {
            priceHistoryRepository.insert(entry);
        } catch (DuplicateKeyException e) {
            log.debug("price_history already has {} {}", request.assetSymbol(), request.date());
        }
    }

    static Optional<BigDecimal> parseUsdPrice(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode usd = MAPPER.readTree(json).path("market_data").path("current_price").path("usd");
            if (usd.isMissingNode() || !usd.isNumber()) {
                return Optional.empty();
            }
            return Optional.of(usd.decimalValue().setScale(SCALE, ROUNDING));
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
