package com.portfolioradar.portfolio;

import com.portfolioradar.common.Symbols;
import com.portfolioradar.domain.Asset;
import com.portfolioradar.domain.AssetCategory;
import com.portfolioradar.domain.AssetRepository;
import com.portfolioradar.domain.BackfillCompletedEvent;
import com.portfolioradar.domain.DailySnapshot;
import com.portfolioradar.domain.DailySnapshotRepository;
import com.portfolioradar.domain.HoldingState;
import com.portfolioradar.domain.HoldingStateRepository;
import com.portfolioradar.domain.TransactionRecord;
import com.portfolioradar.domain.TransactionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side over holdings, the ledger and daily snapshots.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PortfolioQueryService {

    public static final Duration RECENT_WINDOW = Duration.ofDays(3);
    public static final int RECENT_LIMIT = 10;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final HoldingStateRepository holdingStateRepository;
    private final AssetRepository assetRepository;
    private final TransactionRecordRepository transactionRecordRepository;
    private final DailySnapshotRepository dailySnapshotRepository;

    public PortfolioSummary summary() {
        List<HoldingState> holdings = openHoldings();
        if (holdings.isEmpty()) {
            return PortfolioSummary.EMPTY;
        }
        BigDecimal invested = sum(holdings, HoldingState::getInvested);
        BigDecimal value = sum(holdings, HoldingState::getMarketValue);
        BigDecimal pnl = sum(holdings, HoldingState::getUnrealizedPnl);
        return new PortfolioSummary(invested, value, pnl, holdings.size());
    }

    /**
     * Current value per category, largest first. Holdings whose asset is missing from the registry count as STOCKS,
     * the registry's default category.
     */
    public List<CategoryAllocation> diversification() {
        List<HoldingState> holdings = openHoldings();
        Map<String, AssetCategory> categories = assetRepository
                .findBySymbolIn(holdings.stream().map(HoldingState::getAssetSymbol).toList())
                .stream()
                .filter(a -> a.getCategory() != null)
                .collect(Collectors.toMap(Asset::getSymbol, Asset::getCategory, (a, b) -> a));

        Map<AssetCategory, BigDecimal> byCategory = new EnumMap<>(AssetCategory.class);
        for (HoldingState h : holdings) {
            AssetCategory category = categories.getOrDefault(h.getAssetSymbol(), AssetCategory.STOCKS);
            byCategory.merge(category, nz(h.getMarketValue()), BigDecimal::add);
        }
        BigDecimal total = byCategory.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);

        List<CategoryAllocation> out = new ArrayList<>();
        byCategory.forEach((category, value) -> out.add(new CategoryAllocation(category, value,
                total.signum() > 0
                        ? value.multiply(HUNDRED).divide(total, 0, RoundingMode.HALF_UP)
                        : BigDecimal.ZERO)));
        out.sort(Comparator.comparing(CategoryAllocation::value).reversed());
        return out;
    }

    /**
     * Open holdings, largest market value first.
     */
    public List<HoldingState> holdings() {
        List<HoldingState> holdings = new ArrayList<>(openHoldings());
        holdings.sort(Comparator.comparing((HoldingState h) -> nz(h.getMarketValue())).reversed()
                .thenComparing(HoldingState::getAssetSymbol));
        return holdings;
    }

    /**
     * Ledger, newest first.
     *
     * @param page zero-based
     */
    public TransactionPage transactions(int page, int size) {
        if (page < 0 || size <= 0) {
            throw new IllegalArgumentException("page must be >= 0 and size > 0");
        }
        Sort newestFirst = Sort.by(Sort.Order.desc("occurredAt"), Sort.Order.desc("createdAt"));
        Page<TransactionRecord> result = transactionRecordRepository.findAll(PageRequest.of(page, size, newestFirst));
        return new TransactionPage(result.getContent(), page, size, result.getTotalElements());
    }

    /**
     * Up to {@value #RECENT_LIMIT} transactions of the last three days, newest first.
     */
    public List<TransactionRecord> recentTransactions() {
        Instant since = Instant.now().minus(RECENT_WINDOW);
        return transactionRecordRepository.findByOccurredAtGreaterThanEqualOrderByOccurredAtDesc(
                since, PageRequest.of(0, RECENT_LIMIT));
    }

    /**
     * Daily snapshots of one asset, oldest first.
     */
    @Cacheable(cacheNames = "snapshotSeriesCache", key = "'asset-' + #assetSymbol.toUpperCase() + '-' + #from + '-' + #to")
    public List<DailySnapshot> snapshotSeries(String assetSymbol, LocalDate from, LocalDate to) {
        return List.copyOf(dailySnapshotRepository.findRange(Symbols.normalize(assetSymbol), from, to));
    }

    /**
     * Whole-portfolio value per day, summed over every asset's snapshot for that day.
     */
    @Cacheable(cacheNames = "snapshotSeriesCache", key = "'portfolio-' + #from + '-' + #to")
    public List<PortfolioValuePoint> portfolioSeries(LocalDate from, LocalDate to) {
        Map<LocalDate, PortfolioValuePoint> byDate = new TreeMap<>();
        for (DailySnapshot s : dailySnapshotRepository.findRangeAllAssets(from, to)) {
            byDate.merge(s.getSnapshotDate(),
                    new PortfolioValuePoint(s.getSnapshotDate(), nz(s.getTotalValue()), nz(s.getUnrealizedPnl())),
                    (a, b) -> new PortfolioValuePoint(a.date(), a.totalValue().add(b.totalValue()),
                            a.unrealizedPnl().add(b.unrealizedPnl())));
        }
        return List.copyOf(byDate.values());
    }

    @EventListener
    @CacheEvict(cacheNames = "snapshotSeriesCache", allEntries = true)
    public void onBackfillCompleted(BackfillCompletedEvent event) {
        log.debug("Snapshot series cache evicted after backfill of {} asset(s)", event.assetSymbols().size());
    }

    private List<HoldingState> openHoldings() {
        return holdingStateRepository.findAll().stream()
                .filter(h -> h.getQuantity() != null && h.getQuantity().signum() > 0)
                .toList();
    }

    private static BigDecimal sum(List<HoldingState> holdings, Function<HoldingState, BigDecimal> field) {
        return holdings.stream().map(field).map(PortfolioQueryService::nz).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal nz(BigDecimal v) {
        return v != null ? v : BigDecimal.ZERO;
    }
}
