package com.portfolioradar.ledger;

import com.portfolioradar.common.Symbols;
import com.portfolioradar.domain.Asset;
import com.portfolioradar.domain.AssetCategory;
import com.portfolioradar.domain.AssetRepository;
import com.portfolioradar.domain.LedgerMutatedEvent;
import com.portfolioradar.domain.TransactionKind;
import com.portfolioradar.domain.TransactionRecord;
import com.portfolioradar.domain.TransactionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ledger mutations: record a leg, record a trade (two legs), delete by id, delete a whole trade.
 * Each mutation publishes LedgerMutatedEvent for the affected assets; holdings are re-projected synchronously by the
 * listener. A failed projection never undoes the ledger write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    static final String MANUAL_SOURCE = "manual";
    private static final int SCALE = 18;

    private final TransactionRecordRepository transactionRecordRepository;
    private final AssetRepository assetRepository;
    private final TradeNormalizer tradeNormalizer;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * Validates and inserts one leg. BUY/SELL refresh the registry price with pricePerUnit; trade legs recorded this
     * way get price 0 and total 0 like normalized trades.
     *
     * @throws LedgerServiceException VALIDATION_ERROR on missing or invalid fields
     */
    public TransactionRecord recordTransaction(TransactionRequest request) {
        validate(request);
        String symbol = Symbols.normalize(request.assetSymbol());
        TransactionKind kind = request.kind();
        boolean tradeLeg = kind.isTradeLeg();
        BigDecimal price = tradeLeg ? BigDecimal.ZERO : request.pricePerUnit();

        ensureAsset(symbol, request.assetName(), request.category(), request.apiSource(), request.apiId(),
                tradeLeg ? null : price);

        TransactionRecord record = new TransactionRecord();
        record.setKind(kind);
        record.setAssetSymbol(symbol);
        record.setQuantity(request.quantity());
        record.setPricePerUnit(price);
        record.setTotalAmount(request.quantity().multiply(price).setScale(SCALE, RoundingMode.HALF_UP));
        record.setFees(request.fees() != null ? request.fees() : BigDecimal.ZERO);
        record.setOccurredAt(request.occurredAt() != null ? request.occurredAt() : Instant.now());
        record.setExchange(request.exchange().strip());
        record.setNotes(request.notes() != null ? request.notes() : "");
        record.setCreatedAt(Instant.now());
        TransactionRecord saved = transactionRecordRepository.save(record);

        log.info("Recorded {} {} {} @ {} ({})", kind, saved.getQuantity().toPlainString(), symbol,
                price.toPlainString(), saved.getId());
        applicationEventPublisher.publishEvent(new LedgerMutatedEvent(Set.of(symbol)));
        return saved;
    }

    /**
     * Normalizes the trade into TRADE_OUT / TRADE_IN legs, registers stub assets when missing and inserts both legs.
     *
     * @throws LedgerServiceException VALIDATION_ERROR on missing or invalid fields
     */
    public TradeLegs recordTrade(TradeRequest request) {
        TradeLegs legs = tradeNormalizer.normalize(request);
        ensureAsset(legs.outLeg().getAssetSymbol(), null, AssetCategory.CRYPTO, null, null, null);
        ensureAsset(legs.inLeg().getAssetSymbol(), null, AssetCategory.CRYPTO, null, null, null);

        Instant now = Instant.now();
        legs.outLeg().setCreatedAt(now);
        legs.inLeg().setCreatedAt(now);
        List<TransactionRecord> saved = transactionRecordRepository.saveAll(legs.asList());
        TradeLegs result = new TradeLegs(saved.get(0), saved.get(1));

        log.info("Recorded trade {}: {}", result.tradeGroupId(), result.outLeg().getNotes());
        applicationEventPublisher.publishEvent(new LedgerMutatedEvent(
                Set.of(result.outLeg().getAssetSymbol(), result.inLeg().getAssetSymbol())));
        return result;
    }

    /**
     * Deletes one leg by id and re-projects its asset. The paired leg of a trade is left in place; use
     * {@link #deleteTrade(String)} to remove both.
     *
     * @throws LedgerServiceException TRANSACTION_NOT_FOUND if no record has this id
     */
    public TransactionRecord deleteTransaction(String id) {
        TransactionRecord record = (id == null ? null : transactionRecordRepository.findById(id).orElse(null));
        if (record == null) {
            throw new LedgerServiceException(LedgerServiceException.TRANSACTION_NOT_FOUND, "Transaction not found: " + id);
        }
        transactionRecordRepository.delete(record);
        if (record.getTradeGroupId() != null) {
            log.warn("Deleted leg {} of trade {}; the paired leg is kept", id, record.getTradeGroupId());
        } else {
            log.info("Deleted transaction {} ({} {})", id, record.getKind(), record.getAssetSymbol());
        }
        applicationEventPublisher.publishEvent(new LedgerMutatedEvent(Set.of(record.getAssetSymbol())));
        return record;
    }

    /**
     * Deletes every leg sharing the trade group id and re-projects the affected assets.
     *
     * @throws LedgerServiceException TRANSACTION_NOT_FOUND if no leg carries this group id
     */
    public List<TransactionRecord> deleteTrade(String tradeGroupId) {
        List<TransactionRecord> legs = tradeGroupId == null ? List.of()
                : transactionRecordRepository.findByTradeGroupId(tradeGroupId);
        if (legs.isEmpty()) {
            throw new LedgerServiceException(LedgerServiceException.TRANSACTION_NOT_FOUND, "Trade not found: " + tradeGroupId);
        }
        transactionRecordRepository.deleteAll(legs);
        Set<String> symbols = new LinkedHashSet<>();
        legs.forEach(l -> symbols.add(l.getAssetSymbol()));
        log.info("Deleted trade {} ({} legs)", tradeGroupId, legs.size());
        applicationEventPublisher.publishEvent(new LedgerMutatedEvent(symbols));
        return legs;
    }

    public List<TransactionRecord> findTradeLegs(String tradeGroupId) {
        return transactionRecordRepository.findByTradeGroupId(tradeGroupId);
    }

    private void validate(TransactionRequest request) {
        if (request == null) {
            throw LedgerServiceException.validation("Transaction request is required");
        }
        if (request.kind() == null) {
            throw LedgerServiceException.validation("kind is required");
        }
        if (Symbols.normalize(request.assetSymbol()) == null) {
            throw LedgerServiceException.validation("assetSymbol is required");
        }
        if (request.exchange() == null || request.exchange().isBlank()) {
            throw LedgerServiceException.validation("exchange is required");
        }
        if (request.quantity() == null || request.quantity().signum() <= 0) {
            throw LedgerServiceException.validation("quantity must be positive");
        }
        if (!request.kind().isTradeLeg()
                && (request.pricePerUnit() == null || request.pricePerUnit().signum() < 0)) {
            throw LedgerServiceException.validation("pricePerUnit is required and must not be negative");
        }
        if (request.fees() != null && request.fees().signum() < 0) {
            throw LedgerServiceException.validation("fees must not be negative");
        }
    }

    /**
     * Creates the registry entry when missing (price 0 unless given). For an existing entry only a positive observed
     * price is written back.
     */
    private void ensureAsset(String symbol, String name, AssetCategory category, String apiSource, String apiId,
                             BigDecimal observedPrice) {
        Instant now = Instant.now();
        Asset asset = assetRepository.findBySymbol(symbol).orElse(null);
        if (asset == null) {
            asset = new Asset();
            asset.setSymbol(symbol);
            asset.setName(name != null && !name.isBlank() ? name : symbol);
            asset.setCategory(category != null ? category : AssetCategory.STOCKS);
            asset.setApiSource(apiSource != null && !apiSource.isBlank() ? apiSource : MANUAL_SOURCE);
            asset.setApiId(apiId != null && !apiId.isBlank() ? apiId : symbol);
            asset.setCurrentPrice(observedPrice != null ? observedPrice : BigDecimal.ZERO);
            asset.setPriceUpdatedAt(now);
            asset.setCreatedAt(now);
            assetRepository.save(asset);
            log.info("Registered asset {} ({})", symbol, asset.getCategory());
            return;
        }
        if (observedPrice != null && observedPrice.signum() > 0) {
            asset.setCurrentPrice(observedPrice);
            asset.setPriceUpdatedAt(now);
            assetRepository.save(asset);
        }
    }
}
