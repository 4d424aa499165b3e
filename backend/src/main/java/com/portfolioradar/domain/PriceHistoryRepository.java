package com.portfolioradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for price_history.
 */
public interface PriceHistoryRepository extends MongoRepository<PriceHistoryEntry, String> {

    Optional<PriceHistoryEntry> findByAssetSymbolAndPriceDate(String assetSymbol, LocalDate priceDate);

    /** Inclusive on both ends. */
    @Query(value = "{ 'assetSymbol': ?0, 'priceDate': { $gte: ?1, $lte: ?2 } }", sort = "{ 'priceDate': 1 }")
    List<PriceHistoryEntry> findRange(String assetSymbol, LocalDate from, LocalDate to);
}
