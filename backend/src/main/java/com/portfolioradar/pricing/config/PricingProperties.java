package com.portfolioradar.pricing.config;

import com.portfolioradar.domain.AssetCategory;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pricing module configuration. Documented in application.yml under portfolioradar.pricing.
 */
@ConfigurationProperties(prefix = "portfolioradar.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * CoinGecko API base URL (free: https://api.coingecko.com/api/v3).
     */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /**
     * Shared CoinGecko budget for spot and history calls.
     */
    private int coingeckoRequestsPerMinute = 30;

    /**
     * Upper bound for one quote request; on timeout the last persisted price is used.
     */
    private int requestTimeoutSeconds = 10;

    /**
     * Query CoinGecko /coins/{id}/history during backfill when price_history has no row. Off by default: one call per
     * asset and day exhausts the free tier quickly.
     */
    private boolean historicalLookupEnabled = false;

    /**
     * Static quotes by symbol for assets without a live feed (equities, ETFs).
     */
    private Map<String, BigDecimal> quotes = new HashMap<>();

    /**
     * Equities and ETFs offered by asset search next to CoinGecko coins, by ticker.
     */
    private Map<String, AssetCategory> listedSymbols = defaultListedSymbols();

    /**
     * Periodic registry price refresh.
     */
    private Refresh refresh = new Refresh();

    private static Map<String, AssetCategory> defaultListedSymbols() {
        Map<String, AssetCategory> listed = new LinkedHashMap<>();
        for (String stock : new String[]{"AAPL", "MSFT", "GOOGL", "AMZN", "TSLA", "NVDA", "META", "NFLX", "AMD", "INTC"}) {
            listed.put(stock, AssetCategory.STOCKS);
        }
        for (String etf : new String[]{"SPY", "QQQ", "VTI", "VOO", "IVV", "VEA", "IEMG", "VWO", "AGG", "BND"}) {
            listed.put(etf, AssetCategory.ETFS);
        }
        return listed;
    }

    @Getter
    @Setter
    public static class Refresh {
        private boolean enabled = true;
        private long intervalMs = 900_000;
    }
}
