package com.portfolioradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for the asset registry.
 */
public interface AssetRepository extends MongoRepository<Asset, String> {

    Optional<Asset> findBySymbol(String symbol);

    boolean existsBySymbol(String symbol);

    List<Asset> findAllByOrderBySymbolAsc();

    List<Asset> findBySymbolIn(Collection<String> symbols);
}
