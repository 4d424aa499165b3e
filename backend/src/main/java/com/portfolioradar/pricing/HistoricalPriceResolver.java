package com.portfolioradar.pricing;

import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resolves the price of an asset on a past date from real sources. Unknown results are filled in by the caller.
 */
public interface HistoricalPriceResolver {

    PriceResolutionResult resolve(HistoricalPriceRequest request);

    /**
     * Resolves every day of an inclusive range. Only known prices are in the returned map.
     */
    default Map<LocalDate, PriceResolutionResult> resolveRange(String assetSymbol, String coinGeckoId,
                                                             LocalDate from, LocalDate to) {
        Map<LocalDate, PriceResolutionResult> known = new TreeMap<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            PriceResolutionResult r = resolve(new HistoricalPriceRequest(assetSymbol, coinGeckoId, d));
            if (!r.isUnknown()) {
                known.put(d, r);
            }
        }
        return known;
    }
}
