package com.portfolioradar.pricing;

import com.portfolioradar.pricing.resolver.CoinGeckoHistoricalResolver;
import com.portfolioradar.pricing.resolver.StoredPriceHistoryResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

/**
 * Chain: stored price_history → CoinGecko history → UNKNOWN.
 */
@Component
@RequiredArgsConstructor
public class HistoricalPriceResolverChain implements HistoricalPriceResolver {

    private final StoredPriceHistoryResolver storedPriceHistoryResolver;
    private final CoinGeckoHistoricalResolver coinGeckoHistoricalResolver;

    @Override
    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        PriceResolutionResult r = storedPriceHistoryResolver.resolve(request);
        if (!r.isUnknown()) {
            return r;
        }
        return coinGeckoHistoricalResolver.resolve(request);
    }

    @Override
    public Map<LocalDate, PriceResolutionResult> resolveRange(String assetSymbol, String coinGeckoId,
                                                             LocalDate from, LocalDate to) {
        Map<LocalDate, PriceResolutionResult> known =
                new TreeMap<>(storedPriceHistoryResolver.resolveRange(assetSymbol, from, to));
        if (coinGeckoId == null) {
            return known;
        }
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            if (known.containsKey(d)) {
                continue;
            }
            PriceResolutionResult r = coinGeckoHistoricalResolver.resolve(
                    new HistoricalPriceRequest(assetSymbol, coinGeckoId, d));
            if (!r.isUnknown()) {
                known.put(d, r);
            }
        }
        return known;
    }
}
