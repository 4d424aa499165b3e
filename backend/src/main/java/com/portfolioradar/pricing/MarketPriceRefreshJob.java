package com.portfolioradar.pricing;

import com.portfolioradar.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes registry prices; holdings are re-projected by the MarketPricesRefreshedEvent listener.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MarketPriceRefreshJob {

    private final MarketPriceService marketPriceService;
    private final PricingProperties pricingProperties;

    @Scheduled(fixedDelayString = "${portfolioradar.pricing.refresh.interval-ms:900000}",
            initialDelayString = "${portfolioradar.pricing.refresh.interval-ms:900000}")
    public void run() {
        if (!pricingProperties.getRefresh().isEnabled()) {
            return;
        }
        try {
            marketPriceService.refreshAll();
        } catch (RuntimeException e) {
            log.error("Market price refresh failed", e);
        }
    }
}
