package com.portfolioradar.pricing;

import com.portfolioradar.common.Symbols;
import com.portfolioradar.domain.Asset;
import com.portfolioradar.domain.AssetRepository;
import com.portfolioradar.domain.MarketPricesRefreshedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Current market prices. Live quotes come from the first {@link MarketPriceProvider} that supports the asset; when
 * none answers, the registry's last persisted price is used, then 0. Never throws for upstream failures.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketPriceService {

    private final AssetRepository assetRepository;
    private final List<MarketPriceProvider> providers;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * Live quote only.
     */
    public Optional<BigDecimal> fetchPrice(Asset asset) {
        for (MarketPriceProvider provider : providers) {
            if (!provider.supports(asset)) {
                continue;
            }
            try {
                Optional<BigDecimal> price = provider.fetchPrice(asset);
                if (price.isPresent()) {
                    return price;
                }
            } catch (PriceUnavailableException e) {
                log.warn("Price unavailable for {} from {}: {}", asset.getSymbol(),
                        provider.getClass().getSimpleName(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * Live quote, else last persisted price, else 0. Does not write the registry.
     */
    public BigDecimal currentPrice(String assetSymbol) {
        Optional<Asset> asset = assetRepository.findBySymbol(Symbols.normalize(assetSymbol));
        if (asset.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return fetchPrice(asset.get()).orElseGet(() -> lastKnownPrice(asset.get()));
    }

    /**
     * Fetches a live quote and stores it as the asset's current price. Publishes {@link MarketPricesRefreshedEvent}
     * when the price changed.
     *
     * @return the price now in the registry (the previous one when no quote was available)
     */
    public BigDecimal refresh(String assetSymbol) {
        Asset asset = assetRepository.findBySymbol(Symbols.normalize(assetSymbol))
                .orElseThrow(() -> new IllegalArgumentException("Unknown asset: " + assetSymbol));
        Optional<BigDecimal> live = fetchPrice(asset);
        if (live.isEmpty()) {
            return lastKnownPrice(asset);
        }
        if (applyPrice(asset, live.get())) {
            applicationEventPublisher.publishEvent(new MarketPricesRefreshedEvent(Set.of(asset.getSymbol())));
        }
        return live.get();
    }

    /**
     * Refreshes every registry asset; one event for all changed symbols.
     *
     * @return number of assets whose price changed
     */
    public int refreshAll() {
        Set<String> changed = new LinkedHashSet<>();
        for (Asset asset : assetRepository.findAllByOrderBySymbolAsc()) {
            Optional<BigDecimal> live = fetchPrice(asset);
            if (live.isPresent() && applyPrice(asset, live.get())) {
                changed.add(asset.getSymbol());
            }
        }
        if (!changed.isEmpty()) {
            applicationEventPublisher.publishEvent(new MarketPricesRefreshedEvent(changed));
        }
        log.info("Market price refresh: {} asset(s) changed", changed.size());
        return changed.size();
    }

    /**
     * Sets a price by hand (assets without a feed).
     */
    public void setManualPrice(String assetSymbol, BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("price must be >= 0");
        }
        Asset asset = assetRepository.findBySymbol(Symbols.normalize(assetSymbol))
                .orElseThrow(() -> new IllegalArgumentException("Unknown asset: " + assetSymbol));
        if (applyPrice(asset, price)) {
            applicationEventPublisher.publishEvent(new MarketPricesRefreshedEvent(Set.of(asset.getSymbol())));
        }
    }

    private boolean applyPrice(Asset asset, BigDecimal price) {
        BigDecimal previous = asset.getCurrentPrice();
        asset.setPriceUpdatedAt(Instant.now());
        boolean changed = previous == null || previous.compareTo(price) != 0;
        if (changed) {
            asset.setCurrentPrice(price);
        }
        assetRepository.save(asset);
        return changed;
    }

    private static BigDecimal lastKnownPrice(Asset asset) {
        return asset.getCurrentPrice() != null ? asset.getCurrentPrice() : BigDecimal.ZERO;
    }
}
