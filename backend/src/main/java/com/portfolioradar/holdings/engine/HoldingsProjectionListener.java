package com.portfolioradar.holdings.engine;

import com.portfolioradar.domain.LedgerMutatedEvent;
import com.portfolioradar.domain.MarketPricesRefreshedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Re-projects holdings synchronously on ledger mutations and price refreshes. A failure here leaves the holding stale
 * but never propagates to the ledger write that triggered it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HoldingsProjectionListener {

    private final HoldingsProjector holdingsProjector;

    @EventListener
    public void onLedgerMutated(LedgerMutatedEvent event) {
        reproject(event.assetSymbols());
    }

    @EventListener
    public void onMarketPricesRefreshed(MarketPricesRefreshedEvent event) {
        reproject(event.assetSymbols());
    }

    private void reproject(Set<String> symbols) {
        for (String symbol : symbols) {
            try {
                holdingsProjector.projectAndPersist(symbol);
            } catch (Exception e) {
                log.error("Holdings projection failed for {}; holding is stale until the next projection: {}",
                        symbol, e.getMessage(), e);
            }
        }
    }
}
