package com.portfolioradar.holdings.engine;

import com.portfolioradar.common.AssetLocks;
import com.portfolioradar.common.Symbols;
import com.portfolioradar.domain.Asset;
import com.portfolioradar.domain.AssetRepository;
import com.portfolioradar.domain.HoldingState;
import com.portfolioradar.domain.HoldingStateRepository;
import com.portfolioradar.domain.LedgerFolds;
import com.portfolioradar.domain.PositionTotals;
import com.portfolioradar.domain.TransactionRecord;
import com.portfolioradar.domain.TransactionRecordRepository;
import com.portfolioradar.holdings.policy.CostBasis;
import com.portfolioradar.holdings.policy.CostBasisFallbackPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Derives the current position of an asset from its full ledger history and persists it (upsert, or delete when the
 * position is closed). Recomputes from scratch on every call. Read-compute-write runs under the asset's lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HoldingsProjector {

    static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final TransactionRecordRepository transactionRecordRepository;
    private final HoldingStateRepository holdingStateRepository;
    private final AssetRepository assetRepository;
    private final CostBasisFallbackPolicy costBasisFallbackPolicy;
    private final AssetLocks assetLocks;

    /**
     * Pure projection. Empty when net quantity is zero or negative.
     *
     * @param marketPrice latest known market price; null is treated as 0
     */
    public Optional<HoldingState> project(String assetSymbol, List<TransactionRecord> records, BigDecimal marketPrice) {
        BigDecimal price = marketPrice != null ? marketPrice : BigDecimal.ZERO;
        PositionTotals totals = LedgerFolds.fold(records);
        if (!totals.hasPosition()) {
            return Optional.empty();
        }
        BigDecimal quantity = totals.clampedQuantity();
        BigDecimal netInvested = totals.netInvestedFiat();
        CostBasis basis = netInvested.signum() > 0
                ? new CostBasis(netInvested.divide(quantity, SCALE, ROUNDING),
                        netInvested.setScale(SCALE, ROUNDING), false)
                : costBasisFallbackPolicy.resolve(quantity, netInvested, price);

        BigDecimal marketValue = quantity.multiply(price).setScale(SCALE, ROUNDING);
        HoldingState state = new HoldingState();
        state.setAssetSymbol(assetSymbol);
        state.setQuantity(quantity);
        state.setAvgCost(basis.avgCost());
        state.setInvested(basis.invested());
        state.setMarketPrice(price);
        state.setMarketValue(marketValue);
        state.setUnrealizedPnl(marketValue.subtract(basis.invested()));
        state.setCostBasisEstimated(basis.estimated());
        return Optional.of(state);
    }

    /**
     * Loads the asset's ledger and registry price, projects, then upserts or deletes the holding row.
     *
     * @return the persisted holding, empty when the position is closed
     */
    public Optional<HoldingState> projectAndPersist(String assetSymbol) {
        String symbol = Symbols.normalize(assetSymbol);
        if (symbol == null) {
            throw new IllegalArgumentException("assetSymbol must not be blank");
        }
        return assetLocks.withLock(symbol, () -> {
            List<TransactionRecord> records = LedgerFolds.inReplayOrder(
                    transactionRecordRepository.findByAssetSymbolOrderByOccurredAtAsc(symbol));
            BigDecimal marketPrice = assetRepository.findBySymbol(symbol)
                    .map(Asset::getCurrentPrice)
                    .orElse(BigDecimal.ZERO);

            Optional<HoldingState> projected = project(symbol, records, marketPrice);
            if (projected.isEmpty()) {
                holdingStateRepository.deleteByAssetSymbol(symbol);
                log.debug("Position closed for {} ({} legs)", symbol, records.size());
                return Optional.<HoldingState>empty();
            }
            HoldingState state = projected.get();
            holdingStateRepository.findByAssetSymbol(symbol).ifPresent(existing -> state.setId(existing.getId()));
            state.setLastCalculatedAt(Instant.now());
            HoldingState saved = holdingStateRepository.save(state);
            log.debug("Projected {}: qty={} avgCost={} estimated={}", symbol, saved.getQuantity().toPlainString(),
                    saved.getAvgCost().toPlainString(), saved.isCostBasisEstimated());
            return Optional.of(saved);
        });
    }

    /**
     * Re-projects every registry asset. Per-asset failures are logged and skipped.
     *
     * @return number of assets projected successfully
     */
    public int projectAll() {
        int ok = 0;
        for (Asset asset : assetRepository.findAllByOrderBySymbolAsc()) {
            try {
                projectAndPersist(asset.getSymbol());
                ok++;
            } catch (Exception e) {
                log.error("Holdings projection failed for {}: {}", asset.getSymbol(), e.getMessage(), e);
            }
        }
        log.info("Re-projected holdings for {} assets", ok);
        return ok;
    }
}
