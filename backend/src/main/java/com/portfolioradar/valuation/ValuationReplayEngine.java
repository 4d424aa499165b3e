package com.portfolioradar.valuation;

import com.portfolioradar.common.Symbols;
import com.portfolioradar.domain.LedgerFolds;
import com.portfolioradar.domain.PositionTotals;
import com.portfolioradar.domain.TransactionRecord;
import com.portfolioradar.domain.TransactionRecordRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;

/**
 * Replays an asset's ledger up to a calendar day and values the resulting position at a given price.
 * Independent of current holdings. Legs are cut by calendar day in the configured zone, not by timestamp.
 * <p>
 * Invested-to-date counts BUY and TRADE_IN legs only; sells are not netted out, unlike holdings projection.
 */
@Component
public class ValuationReplayEngine {

    static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private final TransactionRecordRepository transactionRecordRepository;
    private final ZoneId zone;

    public ValuationReplayEngine(TransactionRecordRepository transactionRecordRepository,
                                 @Value("${portfolioradar.snapshot.zone:UTC}") String zone) {
        this.transactionRecordRepository = transactionRecordRepository;
        this.zone = ZoneId.of(zone);
    }

    /**
     * Loads the asset's ledger and replays it as of {@code asOfDate}.
     */
    public Valuation replayAsOf(String assetSymbol, LocalDate asOfDate, BigDecimal priceOnDate) {
        String symbol = Symbols.normalize(assetSymbol);
        if (symbol == null || asOfDate == null) {
            throw new IllegalArgumentException("assetSymbol and asOfDate are required");
        }
        List<TransactionRecord> ledger = transactionRecordRepository.findByAssetSymbolOrderByOccurredAtAsc(symbol);
        return replay(symbol, ledger, asOfDate, priceOnDate);
    }

    /**
     * Pure replay over an already loaded ledger. Same inputs always give an equal Valuation.
     *
     * @param priceOnDate null is treated as 0
     */
    public Valuation replay(String assetSymbol, Collection<TransactionRecord> ledger, LocalDate asOfDate,
                            BigDecimal priceOnDate) {
        BigDecimal price = priceOnDate != null ? priceOnDate : BigDecimal.ZERO;
        List<TransactionRecord> upToDate = LedgerFolds.upToDate(ledger, asOfDate, zone);
        PositionTotals totals = LedgerFolds.fold(upToDate);
        BigDecimal invested = LedgerFolds.sumInflowFiat(upToDate).setScale(SCALE, ROUNDING);
        BigDecimal quantity = totals.clampedQuantity();

        if (quantity.signum() == 0) {
            return new Valuation(assetSymbol, asOfDate, BigDecimal.ZERO, price, invested, BigDecimal.ZERO, BigDecimal.ZERO);
        }
        BigDecimal totalValue = quantity.multiply(price).setScale(SCALE, ROUNDING);
        return new Valuation(assetSymbol, asOfDate, quantity, price, invested, totalValue,
                totalValue.subtract(invested));
    }

    public ZoneId getZone() {
        return zone;
    }
}
