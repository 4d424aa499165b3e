package com.portfolioradar.pricing.quote;

import com.portfolioradar.common.RateLimiter;
import com.portfolioradar.domain.Asset;
import com.portfolioradar.domain.AssetCategory;
import com.portfolioradar.pricing.PriceUnavailableException;
import com.portfolioradar.pricing.config.PricingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoinGeckoSpotPriceProviderTest {

    private PricingProperties props;
    private final List<URI> requested = new ArrayList<>();

    @BeforeEach
    void setUp() {
        props = new PricingProperties();
        props.setCoingeckoBaseUrl("https://api.coingecko.com/api/v3");
    }

    private CoinGeckoSpotPriceProvider provider(HttpStatus status, String body) {
        WebClient.Builder webClientBuilder = WebClient.builder()
                .exchangeFunction(req -> {
                    requested.add(req.url());
                    return Mono.just(ClientResponse.create(status)
                            .header("Content-Type", "application/json")
                            .body(body)
                            .build());
                });
        return new CoinGeckoSpotPriceProvider(props, webClientBuilder, new RateLimiter(Duration.ZERO));
    }

    private static Asset coin(String symbol, String apiId) {
        Asset a = new Asset();
        a.setSymbol(symbol);
        a.setCategory(AssetCategory.CRYPTO);
        a.setApiSource("coingecko");
        a.setApiId(apiId);
        return a;
    }

    @Test
    @DisplayName("parseUsdPrice extracts usd for coin id")
    void parseUsdPrice() {
        Optional<BigDecimal> price = CoinGeckoSpotPriceProvider.parseUsdPrice("{\"ethereum\": {\"usd\": 3500.25}}",
                "ethereum");
        assertThat(price).isPresent();
        assertThat(price.get()).isEqualByComparingTo("3500.25");
        assertThat(CoinGeckoSpotPriceProvider.parseUsdPrice("{}", "ethereum")).isEmpty();
        assertThat(CoinGeckoSpotPriceProvider.parseUsdPrice("not json", "ethereum")).isEmpty();
    }

    @Test
    @DisplayName("fetchPrice queries /simple/price with the coin id")
    void fetchPrice() {
        CoinGeckoSpotPriceProvider provider = provider(HttpStatus.OK, "{\"ethereum\": {\"usd\": 3500.25}}");

        assertThat(provider.fetchPrice(coin("ETH", "ethereum"))).hasValueSatisfying(
                p -> assertThat(p).isEqualByComparingTo("3500.25"));
        assertThat(requested).hasSize(1);
        assertThat(requested.get(0).toString())
                .isEqualTo("https://api.coingecko.com/api/v3/simple/price?ids=ethereum&vs_currencies=usd");
    }

    @Test
    @DisplayName("unknown coin id yields empty")
    void unknownCoin() {
        assertThat(provider(HttpStatus.OK, "{}").fetchPrice(coin("XYZ", "xyz"))).isEmpty();
    }

    @Test
    @DisplayName("HTTP error surfaces as PriceUnavailableException")
    void httpError() {
        CoinGeckoSpotPriceProvider provider = provider(HttpStatus.TOO_MANY_REQUESTS, "{}");

        assertThatThrownBy(() -> provider.fetchPrice(coin("ETH", "ethereum")))
                .isInstanceOf(PriceUnavailableException.class)
                .hasMessageContaining("ethereum");
    }

    @Test
    @DisplayName("supports only coingecko assets with an api id")
    void supports() {
        CoinGeckoSpotPriceProvider provider = provider(HttpStatus.OK, "{}");
        Asset manual = coin("AAPL", "AAPL");
        manual.setApiSource("manual");
        Asset noId = coin("ETH", " ");

        assertThat(provider.supports(coin("ETH", "ethereum"))).isTrue();
        assertThat(provider.supports(manual)).isFalse();
        assertThat(provider.supports(noId)).isFalse();
        assertThat(provider.supports(null)).isFalse();
    }
}
