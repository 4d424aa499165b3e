package com.portfolioradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for daily_snapshots. Inserts that collide with the unique (assetSymbol, snapshotDate) index raise
 * DuplicateKeyException.
 */
public interface DailySnapshotRepository extends MongoRepository<DailySnapshot, String> {

    boolean existsByAssetSymbolAndSnapshotDate(String assetSymbol, LocalDate snapshotDate);

    Optional<DailySnapshot> findByAssetSymbolAndSnapshotDate(String assetSymbol, LocalDate snapshotDate);

    /** Inclusive on both ends. */
    @Query(value = "{ 'assetSymbol': ?0, 'snapshotDate': { $gte: ?1, $lte: ?2 } }", sort = "{ 'snapshotDate': 1 }")
    List<DailySnapshot> findRange(String assetSymbol, LocalDate from, LocalDate to);

    /** Inclusive on both ends, all assets. */
    @Query(value = "{ 'snapshotDate': { $gte: ?0, $lte: ?1 } }", sort = "{ 'snapshotDate': 1, 'assetSymbol': 1 }")
    List<DailySnapshot> findRangeAllAssets(LocalDate from, LocalDate to);
}
