package com.portfolioradar.snapshot;

import com.portfolioradar.common.RateLimiter;
import com.portfolioradar.common.Symbols;
import com.portfolioradar.config.AsyncConfig;
import com.portfolioradar.domain.Asset;
import com.portfolioradar.domain.AssetRepository;
import com.portfolioradar.domain.BackfillCompletedEvent;
import com.portfolioradar.domain.DailySnapshot;
import com.portfolioradar.domain.DailySnapshotRepository;
import com.portfolioradar.domain.PriceSource;
import com.portfolioradar.domain.TransactionRecord;
import com.portfolioradar.domain.TransactionRecordRepository;
import com.portfolioradar.ledger.LedgerServiceException;
import com.portfolioradar.pricing.HistoricalPriceRequest;
import com.portfolioradar.pricing.HistoricalPriceResolver;
import com.portfolioradar.pricing.PriceResolutionResult;
import com.portfolioradar.snapshot.config.SnapshotConfig;
import com.portfolioradar.snapshot.config.SnapshotProperties;
import com.portfolioradar.valuation.Valuation;
import com.portfolioradar.valuation.ValuationReplayEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Generates missing daily snapshots over an (asset × date) matrix. Each cell is: exists? skip : replay, insert.
 * Existing rows are never rewritten; an insert that loses a race on the unique (assetSymbol, snapshotDate) index
 * counts as skipped. Failures are isolated per asset and per cell and reported, never thrown.
 * <p>
 * Price per cell: real history (price_history, then CoinGecko when enabled), else the random-walk estimate anchored
 * on the registry's current price today.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotBackfillService {

    public static final String ALL_ASSETS = "all";

    private final AssetRepository assetRepository;
    private final TransactionRecordRepository transactionRecordRepository;
    private final DailySnapshotRepository dailySnapshotRepository;
    private final HistoricalPriceResolver historicalPriceResolver;
    private final RandomWalkPriceEstimator randomWalkPriceEstimator;
    private final ValuationReplayEngine valuationReplayEngine;
    private final SnapshotProperties snapshotProperties;
    @Qualifier(SnapshotConfig.BACKFILL_PACER)
    private final RateLimiter backfillPacer;
    @Qualifier(AsyncConfig.BACKFILL_EXECUTOR)
    private final Executor backfillExecutor;
    private final Clock snapshotClock;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * @param assetOrAll an asset symbol, or {@value #ALL_ASSETS} for every registry asset
     * @throws LedgerServiceException VALIDATION_ERROR on a bad range, ASSET_NOT_FOUND for an unknown asset
     */
    public BackfillReport backfill(String assetOrAll, LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw LedgerServiceException.validation("startDate and endDate are required");
        }
        if (startDate.isAfter(endDate)) {
            throw LedgerServiceException.validation("startDate " + startDate + " is after endDate " + endDate);
        }
        List<String> symbols = resolveScope(assetOrAll);

        int parallelism = Math.max(1, snapshotProperties.getBackfill().getParallelism());
        BackfillReport report = parallelism > 1 && symbols.size() > 1
                ? runParallel(symbols, startDate, endDate, parallelism)
                : runSequential(symbols, startDate, endDate);

        log.info("Backfill {} {}..{}: created={} skipped={} errors={}", assetOrAll, startDate, endDate,
                report.created(), report.skipped(), report.errors().size());
        applicationEventPublisher.publishEvent(new BackfillCompletedEvent(new LinkedHashSet<>(symbols),
                startDate, endDate, report.created(), report.skipped(), report.errors().size()));
        return report;
    }

    /**
     * Deletes an asset's snapshots in the range and builds them again, e.g. after price_history was corrected.
     */
    public BackfillReport regenerate(String assetSymbol, LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null || startDate.isAfter(endDate)) {
            throw LedgerServiceException.validation("invalid range " + startDate + ".." + endDate);
        }
        List<String> symbols = resolveScope(assetSymbol);
        for (String symbol : symbols) {
            List<DailySnapshot> existing = dailySnapshotRepository.findRange(symbol, startDate, endDate);
            dailySnapshotRepository.deleteAll(existing);
            log.info("Deleted {} snapshot(s) of {} for regeneration", existing.size(), symbol);
        }
        return backfill(assetSymbol, startDate, endDate);
    }

    public LocalDate today() {
        return LocalDate.now(snapshotClock);
    }

    private List<String> resolveScope(String assetOrAll) {
        if (assetOrAll == null || assetOrAll.isBlank()) {
            throw LedgerServiceException.validation("asset symbol or '" + ALL_ASSETS + "' is required");
        }
        if (ALL_ASSETS.equalsIgnoreCase(assetOrAll.strip())) {
            return assetRepository.findAllByOrderBySymbolAsc().stream().map(Asset::getSymbol).toList();
        }
        String symbol = Symbols.normalize(assetOrAll);
        if (!assetRepository.existsBySymbol(symbol) && !transactionRecordRepository.existsByAssetSymbol(symbol)) {
            throw new LedgerServiceException(LedgerServiceException.ASSET_NOT_FOUND, "Unknown asset: " + symbol);
        }
        return List.of(symbol);
    }

    private BackfillReport runSequential(List<String> symbols, LocalDate from, LocalDate to) {
        BackfillReport report = BackfillReport.EMPTY;
        for (String symbol : symbols) {
            backfillPacer.acquire();
            report = report.plus(backfillAsset(symbol, from, to));
        }
        return report;
    }

    private BackfillReport runParallel(List<String> symbols, LocalDate from, LocalDate to, int parallelism) {
        Semaphore semaphore = new Semaphore(Math.min(parallelism, symbols.size()));
        List<CompletableFuture<BackfillReport>> futures = new ArrayList<>();
        for (String symbol : symbols) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        semaphore.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return assetFailure(symbol, "interrupted");
                    }
                    try {
                        return backfillAsset(symbol, from, to);
                    } finally {
                        semaphore.release();
                    }
                }, backfillExecutor));
            } catch (RejectedExecutionException e) {
                log.warn("Backfill executor rejected {}: {}", symbol, e.getMessage());
                futures.add(CompletableFuture.completedFuture(assetFailure(symbol, "rejected by backfill executor")));
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream()
                .map(CompletableFuture::join)
                .reduce(BackfillReport.EMPTY, BackfillReport::plus);
    }

    /**
     * One asset over the whole range. Setup failures (ledger, prices) fail the asset; cell failures fail the cell.
     */
    BackfillReport backfillAsset(String symbol, LocalDate from, LocalDate to) {
        List<TransactionRecord> ledger;
        Map<LocalDate, PriceResolutionResult> realPrices;
        Map<LocalDate, BigDecimal> estimates;
        try {
            Asset asset = assetRepository.findBySymbol(symbol).orElse(null);
            ledger = transactionRecordRepository.findByAssetSymbolOrderByOccurredAtAsc(symbol);
            String coinGeckoId = asset != null ? HistoricalPriceRequest.forAsset(asset, from).coinGeckoId() : null;
            realPrices = historicalPriceResolver.resolveRange(symbol, coinGeckoId, from, to);
            BigDecimal anchorPrice = asset != null && asset.getCurrentPrice() != null
                    ? asset.getCurrentPrice()
                    : BigDecimal.ZERO;
            estimates = randomWalkPriceEstimator.estimate(symbol, anchorPrice, today(), from, to);
        } catch (RuntimeException e) {
            log.warn("Backfill setup failed for {}: {}", symbol, e.getMessage(), e);
            return assetFailure(symbol, e.getMessage());
        }

        int created = 0;
        int skipped = 0;
        List<BackfillError> errors = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            try {
                if (dailySnapshotRepository.existsByAssetSymbolAndSnapshotDate(symbol, date)) {
                    skipped++;
                    continue;
                }
                PriceResolutionResult real = realPrices.get(date);
                BigDecimal price;
                PriceSource source;
                if (real != null && !real.isUnknown()) {
                    price = real.getPriceUsd().orElseThrow();
                    source = real.getPriceSource();
                } else {
                    price = estimates.getOrDefault(date, BigDecimal.ZERO);
                    source = PriceSource.ESTIMATED;
                }
                Valuation valuation = valuationReplayEngine.replay(symbol, ledger, date, price);
                dailySnapshotRepository.insert(toSnapshot(valuation, source));
                created++;
            } catch (DuplicateKeyException e) {
                log.debug("Snapshot {} {} written concurrently, skipping", symbol, date);
                skipped++;
            } catch (RuntimeException e) {
                log.warn("Backfill cell failed for {} {}: {}", symbol, date, e.getMessage());
                errors.add(new BackfillError(symbol, date, e.getMessage()));
            }
        }
        log.debug("Backfill {} {}..{}: created={} skipped={} errors={}", symbol, from, to, created, skipped,
                errors.size());
        return new BackfillReport(created, skipped, errors);
    }

    private static BackfillReport assetFailure(String symbol, String message) {
        return new BackfillReport(0, 0, List.of(new BackfillError(symbol, null, message)));
    }

    private static DailySnapshot toSnapshot(Valuation valuation, PriceSource source) {
        DailySnapshot snapshot = new DailySnapshot();
        snapshot.setAssetSymbol(valuation.assetSymbol());
        snapshot.setSnapshotDate(valuation.asOfDate());
        snapshot.setQuantity(valuation.quantity());
        snapshot.setPricePerUnit(valuation.pricePerUnit());
        snapshot.setTotalValue(valuation.totalValue());
        snapshot.setUnrealizedPnl(valuation.unrealizedPnl());
        snapshot.setPriceSource(source);
        snapshot.setCreatedAt(Instant.now());
        return snapshot;
    }
}
