package com.portfolioradar.pricing;

import com.portfolioradar.common.Symbols;
import com.portfolioradar.domain.PriceHistoryEntry;
import com.portfolioradar.domain.PriceHistoryRepository;
import com.portfolioradar.domain.PriceSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Import of real daily closes into price_history. Snapshots already written for the date keep their old price;
 * regenerate them through the backfill service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceHistoryService {

    private final PriceHistoryRepository priceHistoryRepository;

    /**
     * Upserts the MANUAL price of an asset on a date.
     *
     * @throws IllegalArgumentException on blank symbol, null date or negative/null price
     */
    @CacheEvict(cacheNames = "historicalPriceCache", allEntries = true)
    public PriceHistoryEntry record(String assetSymbol, LocalDate priceDate, BigDecimal price) {
        String symbol = Symbols.normalize(assetSymbol);
        if (symbol == null) {
            throw new IllegalArgumentException("assetSymbol is required");
        }
        if (priceDate == null) {
            throw new IllegalArgumentException("priceDate is required");
        }
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("price must be >= 0");
        }
        PriceHistoryEntry entry = priceHistoryRepository.findByAssetSymbolAndPriceDate(symbol, priceDate)
                .orElseGet(PriceHistoryEntry::new);
        entry.setAssetSymbol(symbol);
        entry.setPriceDate(priceDate);
        entry.setPrice(price);
        entry.setSource(PriceSource.MANUAL);
        entry.setRecordedAt(Instant.now());
        PriceHistoryEntry saved = priceHistoryRepository.save(entry);
        log.info("Recorded {} price {} for {}", symbol, price, priceDate);
        return saved;
    }

    public List<PriceHistoryEntry> findRange(String assetSymbol, LocalDate from, LocalDate to) {
        return priceHistoryRepository.findRange(Symbols.normalize(assetSymbol), from, to);
    }
}
