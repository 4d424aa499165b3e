package com.portfolioradar.pricing.resolver;

import com.portfolioradar.domain.PriceHistoryEntry;
import com.portfolioradar.domain.PriceHistoryRepository;
import com.portfolioradar.pricing.HistoricalPriceRequest;
import com.portfolioradar.pricing.PriceResolutionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads price_history rows (manual imports and cached CoinGecko lookups).
 */
@Component
@RequiredArgsConstructor
public class StoredPriceHistoryResolver {

    private final PriceHistoryRepository priceHistoryRepository;

    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        if (request == null || request.assetSymbol() == null || request.date() == null) {
            return PriceResolutionResult.unknown();
        }
        return priceHistoryRepository.findByAssetSymbolAndPriceDate(request.assetSymbol(), request.date())
                .map(StoredPriceHistoryResolver::toResult)
                .orElse(PriceResolutionResult.unknown());
    }

    public Map<LocalDate, PriceResolutionResult> resolveRange(String assetSymbol, LocalDate from, LocalDate to) {
        Map<LocalDate, PriceResolutionResult> byDate = new TreeMap<>();
        for (PriceHistoryEntry entry : priceHistoryRepository.findRange(assetSymbol, from, to)) {
            PriceResolutionResult r = toResult(entry);
            if (!r.isUnknown()) {
                byDate.put(entry.getPriceDate(), r);
            }
        }
        return byDate;
    }

    private static PriceResolutionResult toResult(PriceHistoryEntry entry) {
        return PriceResolutionResult.known(entry.getPrice(), entry.getSource());
    }
}
