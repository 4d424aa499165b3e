package com.portfolioradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for holdings. Written only by HoldingsProjector.
 */
public interface HoldingStateRepository extends MongoRepository<HoldingState, String> {

    Optional<HoldingState> findByAssetSymbol(String assetSymbol);

    void deleteByAssetSymbol(String assetSymbol);
}
