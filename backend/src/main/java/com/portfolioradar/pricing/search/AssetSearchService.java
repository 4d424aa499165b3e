package com.portfolioradar.pricing.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolioradar.common.RateLimiter;
import com.portfolioradar.domain.AssetCategory;
import com.portfolioradar.pricing.config.PricingConfig;
import com.portfolioradar.pricing.config.PricingProperties;
import com.portfolioradar.pricing.quote.CoinGeckoSpotPriceProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Finds assets to register: CoinGecko /search for coins, plus the configured equity and ETF tickers. Coin hits carry
 * apiSource "coingecko" and the coin id, so CoinGeckoSpotPriceProvider can price them once registered; listed tickers
 * are priced from configured quotes.
 * <p>
 * A failing CoinGecko call only drops the coin part of the result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetSearchService {

    public static final int MIN_QUERY_LENGTH = 2;
    public static final String LISTED_SOURCE = "manual";
    static final int MAX_COINS = 10;
    static final int MAX_LISTED = 5;
    static final int MAX_RESULTS = 15;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PricingProperties pricingProperties;
    private final WebClient.Builder webClientBuilder;
    @Qualifier(PricingConfig.COINGECKO_RATE_LIMITER)
    private final RateLimiter rateLimiter;

    @Cacheable(cacheNames = "assetSearchCache", key = "#query.strip().toLowerCase()",
            condition = "#query != null", unless = "#result.isEmpty()")
    public List<AssetSearchResult> search(String query) {
        String q = query != null ? query.strip() : "";
        if (q.length() < MIN_QUERY_LENGTH) {
            return List.of();
        }
        List<AssetSearchResult> results = new ArrayList<>(searchCoins(q));
        results.addAll(searchListed(q));
        return List.copyOf(results.size() > MAX_RESULTS ? results.subList(0, MAX_RESULTS) : results);
    }

    private List<AssetSearchResult> searchCoins(String query) {
        rateLimiter.acquire();
        String response;
        try {
            response = webClientBuilder.build()
                    .get()
                    .uri(pricingProperties.getCoingeckoBaseUrl() + "/search?query={query}", query)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(pricingProperties.getRequestTimeoutSeconds()));
        } catch (WebClientResponseException e) {
            log.warn("CoinGecko search failed for '{}': {}", query, e.getStatusCode());
            return List.of();
        } catch (RuntimeException e) {
            log.warn("CoinGecko search error for '{}'", query, e);
            return List.of();
        }
        return parseCoins(response);
    }

    private List<AssetSearchResult> searchListed(String query) {
        String needle = query.toUpperCase(Locale.ROOT);
        List<AssetSearchResult> listed = new ArrayList<>();
        for (Map.Entry<String, AssetCategory> e : pricingProperties.getListedSymbols().entrySet()) {
            String ticker = e.getKey().toUpperCase(Locale.ROOT);
            if (ticker.contains(needle)) {
                listed.add(new AssetSearchResult(ticker, ticker, e.getValue(), LISTED_SOURCE, ticker));
                if (listed.size() == MAX_LISTED) {
                    break;
                }
            }
        }
        return listed;
    }

    static List<AssetSearchResult> parseCoins(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<AssetSearchResult> coins = new ArrayList<>();
            for (JsonNode coin : MAPPER.readTree(json).path("coins")) {
                String id = coin.path("id").asText("");
                String symbol = coin.path("symbol").asText("");
                if (id.isBlank() || symbol.isBlank()) {
                    continue;
                }
                coins.add(new AssetSearchResult(symbol.toUpperCase(Locale.ROOT), coin.path("name").asText(symbol),
                        AssetCategory.CRYPTO, CoinGeckoSpotPriceProvider.SOURCE, id));
                if (coins.size() == MAX_COINS) {
                    break;
                }
            }
            return coins;
        } catch (Exception e) {
            log.debug("Unparseable CoinGecko search payload", e);
            return List.of();
        }
    }
}
