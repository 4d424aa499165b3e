package com.portfolioradar.ledger;

import com.portfolioradar.common.Symbols;
import com.portfolioradar.domain.TransactionKind;
import com.portfolioradar.domain.TransactionRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Splits a trade into two single-asset legs so the ledger only ever holds one asset per record.
 * Both legs carry price 0 and total 0, the same occurredAt, the same note and the same tradeGroupId.
 * Fees are split evenly between the legs; the split is a bookkeeping convention, not an attribution.
 */
@Component
public class TradeNormalizer {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public TradeLegs normalize(TradeRequest request) {
        if (request == null) {
            throw LedgerServiceException.validation("Trade request is required");
        }
        String from = Symbols.normalize(request.assetFrom());
        String to = Symbols.normalize(request.assetTo());
        if (from == null || to == null) {
            throw LedgerServiceException.validation("Both trade assets are required");
        }
        if (from.equals(to)) {
            throw LedgerServiceException.validation("Cannot trade " + from + " for itself");
        }
        requirePositive(request.quantityFrom(), "quantityFrom");
        requirePositive(request.quantityTo(), "quantityTo");
        if (request.exchange() == null || request.exchange().isBlank()) {
            throw LedgerServiceException.validation("exchange is required");
        }
        BigDecimal fees = request.fees() != null ? request.fees() : BigDecimal.ZERO;
        if (fees.signum() < 0) {
            throw LedgerServiceException.validation("fees must not be negative");
        }

        Instant occurredAt = request.occurredAt() != null ? request.occurredAt() : Instant.now();
        String note = tradeNote(from, request.quantityFrom(), to, request.quantityTo(), request.notes());
        String groupId = UUID.randomUUID().toString();
        BigDecimal feePerLeg = fees.divide(TWO);
        String exchange = request.exchange().strip();

        TransactionRecord out = leg(TransactionKind.TRADE_OUT, from, request.quantityFrom(), feePerLeg,
                occurredAt, exchange, note, groupId);
        TransactionRecord in = leg(TransactionKind.TRADE_IN, to, request.quantityTo(), feePerLeg,
                occurredAt, exchange, note, groupId);
        return new TradeLegs(out, in);
    }

    static String tradeNote(String from, BigDecimal qtyFrom, String to, BigDecimal qtyTo, String notes) {
        String base = "Trade: " + plain(qtyFrom) + " " + from + " → " + plain(qtyTo) + " " + to;
        return notes == null || notes.isBlank() ? base : base + " | " + notes.strip();
    }

    private static TransactionRecord leg(TransactionKind kind, String symbol, BigDecimal quantity, BigDecimal fees,
                                         Instant occurredAt, String exchange, String note, String groupId) {
        TransactionRecord r = new TransactionRecord();
        r.setKind(kind);
        r.setAssetSymbol(symbol);
        r.setQuantity(quantity);
        r.setPricePerUnit(BigDecimal.ZERO);
        r.setTotalAmount(BigDecimal.ZERO);
        r.setFees(fees);
        r.setOccurredAt(occurredAt);
        r.setExchange(exchange);
        r.setNotes(note);
        r.setTradeGroupId(groupId);
        return r;
    }

    private static void requirePositive(BigDecimal value, String field) {
        if (value == null || value.signum() <= 0) {
            throw LedgerServiceException.validation(field + " must be positive");
        }
    }

    private static String plain(BigDecimal v) {
        return v.stripTrailingZeros().toPlainString();
    }
}
