package com.portfolioradar.snapshot;

import com.portfolioradar.snapshot.config.SnapshotProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Approximate historical prices for days with no real price. Walks backwards from the anchor price on the anchor
 * date, one day at a time: each step moves at most maxDailyChangePct and the walk never leaves
 * anchor * (1 ± maxDriftPct). Seeded from (symbol, anchorDate), so the same day's re-run yields the same numbers.
 * <p>
 * Demo data, not a price feed.
 */
@Component
public class RandomWalkPriceEstimator {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final BigDecimal maxDailyChange;
    private final BigDecimal maxDrift;

    public RandomWalkPriceEstimator(SnapshotProperties snapshotProperties) {
        this(snapshotProperties.getEstimator().getMaxDailyChangePct(), snapshotProperties.getEstimator().getMaxDriftPct());
    }

    RandomWalkPriceEstimator(BigDecimal maxDailyChange, BigDecimal maxDrift) {
        if (maxDailyChange.signum() < 0 || maxDrift.signum() < 0 || maxDrift.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("estimator bounds out of range");
        }
        this.maxDailyChange = maxDailyChange;
        this.maxDrift = maxDrift;
    }

    /**
     * Estimated price for every day of [from, to]. Days on or after the anchor get the anchor price.
     */
    public Map<LocalDate, BigDecimal> estimate(String assetSymbol, BigDecimal anchorPrice, LocalDate anchorDate,
                                               LocalDate from, LocalDate to) {
        Map<LocalDate, BigDecimal> out = new TreeMap<>();
        BigDecimal anchor = anchorPrice != null && anchorPrice.signum() > 0 ? anchorPrice : BigDecimal.ZERO;
        for (LocalDate d = anchorDate.isAfter(from) ? anchorDate : from; !d.isAfter(to); d = d.plusDays(1)) {
            out.put(d, anchor);
        }
        if (!from.isBefore(anchorDate)) {
            return out;
        }

        BigDecimal floor = anchor.multiply(BigDecimal.ONE.subtract(maxDrift));
        BigDecimal ceiling = anchor.multiply(BigDecimal.ONE.add(maxDrift));
        Random random = new Random(seed(assetSymbol, anchorDate));
        BigDecimal price = anchor;
        for (LocalDate d = anchorDate.minusDays(1); !d.isBefore(from); d = d.minusDays(1)) {
            // uniform in [-maxDailyChange, +maxDailyChange]
            BigDecimal move = maxDailyChange.multiply(BigDecimal.valueOf(random.nextDouble() * 2 - 1));
            price = clamp(price.multiply(BigDecimal.ONE.add(move)), floor, ceiling).setScale(SCALE, ROUNDING);
            if (!d.isAfter(to)) {
                out.put(d, price);
            }
        }
        return out;
    }

    static long seed(String assetSymbol, LocalDate anchorDate) {
        return 31L * (assetSymbol != null ? assetSymbol.hashCode() : 0) + anchorDate.toEpochDay();
    }

    private static BigDecimal clamp(BigDecimal v, BigDecimal min, BigDecimal max) {
        return v.max(min).min(max);
    }
}
