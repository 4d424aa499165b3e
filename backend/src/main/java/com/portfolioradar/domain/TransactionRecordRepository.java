package com.portfolioradar.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

/**
 * Persistence for the transaction ledger. Callers must still sort by occurredAt: backdated inserts make storage
 * order meaningless.
 */
public interface TransactionRecordRepository extends MongoRepository<TransactionRecord, String> {

    List<TransactionRecord> findByAssetSymbolOrderByOccurredAtAsc(String assetSymbol);

    List<TransactionRecord> findByTradeGroupId(String tradeGroupId);

    boolean existsByAssetSymbol(String assetSymbol);

    List<TransactionRecord> findByOccurredAtGreaterThanEqualOrderByOccurredAtDesc(Instant since, Pageable pageable);
}
