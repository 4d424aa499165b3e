package com.portfolioradar.ledger;

import com.portfolioradar.domain.Asset;
import com.portfolioradar.domain.AssetCategory;
import com.portfolioradar.domain.AssetRepository;
import com.portfolioradar.domain.LedgerMutatedEvent;
import com.portfolioradar.domain.TransactionKind;
import com.portfolioradar.domain.TransactionRecord;
import com.portfolioradar.domain.TransactionRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.portfolioradar.domain.LedgerFixtures.buy;
import static com.portfolioradar.domain.LedgerFixtures.tradeIn;
import static com.portfolioradar.domain.LedgerFixtures.tradeOut;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerServiceTest {

    private static final Instant DAY_1 = Instant.parse("2024-01-01T10:00:00Z");

    @Mock
    TransactionRecordRepository transactionRecordRepository;
    @Mock
    AssetRepository assetRepository;
    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    LedgerService ledgerService;

    @BeforeEach
    void setUp() {
        ledgerService = new LedgerService(transactionRecordRepository, assetRepository, new TradeNormalizer(),
                applicationEventPublisher);
    }

    @Test
    @DisplayName("totalAmount of an 18-decimal quantity at an 18-decimal price is kept at scale 18")
    void totalAmountScaled() {
        when(assetRepository.findBySymbol("ETH")).thenReturn(Optional.empty());
        when(transactionRecordRepository.save(any(TransactionRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        TransactionRecord saved = ledgerService.recordTransaction(TransactionRequest.of(TransactionKind.BUY, "ETH",
                "Kraken", new BigDecimal("0.512345678901234567"), new BigDecimal("3556.429217550902827934"),
                BigDecimal.ZERO, DAY_1));

        assertThat(saved.getTotalAmount().scale()).isEqualTo(18);
        assertThat(saved.getTotalAmount().precision()).isLessThanOrEqualTo(34);
        assertThat(saved.getTotalAmount()).isEqualByComparingTo("1822.121141930303754836");
    }

    @Test
    @DisplayName("BUY of an unknown asset registers it at the bought price and publishes a ledger event")
    void recordBuyRegistersAsset() {
        when(assetRepository.findBySymbol("BTC")).thenReturn(Optional.empty());
        when(transactionRecordRepository.save(any(TransactionRecord.class))).thenAnswer(inv -> {
            TransactionRecord r = inv.getArgument(0);
            r.setId("tx1");
            return r;
        });

        TransactionRecord saved = ledgerService.recordTransaction(TransactionRequest.of(TransactionKind.BUY, " btc ",
                "Kraken", new BigDecimal("0.5"), new BigDecimal("60000"), new BigDecimal("10"), DAY_1));

        assertThat(saved.getId()).isEqualTo("tx1");
        assertThat(saved.getAssetSymbol()).isEqualTo("BTC");
        assertThat(saved.getTotalAmount()).isEqualByComparingTo("30000");
        assertThat(saved.getFees()).isEqualByComparingTo("10");
        assertThat(saved.getCreatedAt()).isNotNull();

        ArgumentCaptor<Asset> asset = ArgumentCaptor.forClass(Asset.class);
        verify(assetRepository).save(asset.capture());
        assertThat(asset.getValue().getSymbol()).isEqualTo("BTC");
        assertThat(asset.getValue().getCategory()).isEqualTo(AssetCategory.STOCKS);
        assertThat(asset.getValue().getApiSource()).isEqualTo(LedgerService.MANUAL_SOURCE);
        assertThat(asset.getValue().getCurrentPrice()).isEqualByComparingTo("60000");
        verify(applicationEventPublisher).publishEvent(new LedgerMutatedEvent(Set.of("BTC")));
    }

    @Test
    @DisplayName("SELL of a known asset refreshes its registry price")
    void recordSellUpdatesPrice() {
        Asset existing = new Asset();
        existing.setSymbol("BTC");
        existing.setCurrentPrice(new BigDecimal("60000"));
        when(assetRepository.findBySymbol("BTC")).thenReturn(Optional.of(existing));
        when(transactionRecordRepository.save(any(TransactionRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        ledgerService.recordTransaction(TransactionRequest.of(TransactionKind.SELL, "BTC", "Kraken",
                new BigDecimal("0.2"), new BigDecimal("70000"), new BigDecimal("5"), DAY_1));

        assertThat(existing.getCurrentPrice()).isEqualByComparingTo("70000");
        verify(assetRepository).save(existing);
    }

    @Test
    @DisplayName("trade legs recorded directly are stored at price 0")
    void recordTradeLegDirectly() {
        Asset existing = new Asset();
        existing.setSymbol("BTC");
        existing.setCurrentPrice(new BigDecimal("65000"));
        when(assetRepository.findBySymbol("BTC")).thenReturn(Optional.of(existing));
        when(transactionRecordRepository.save(any(TransactionRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        TransactionRecord saved = ledgerService.recordTransaction(TransactionRequest.of(TransactionKind.TRADE_IN,
                "BTC", "Kraken", new BigDecimal("0.03"), new BigDecimal("99999"), null, DAY_1));

        assertThat(saved.getPricePerUnit()).isZero();
        assertThat(saved.getTotalAmount()).isZero();
        assertThat(existing.getCurrentPrice()).isEqualByComparingTo("65000");
        verify(assetRepository, never()).save(any());
    }

    @Test
    @DisplayName("invalid transaction is rejected before the ledger is touched")
    void invalidTransactionRejected() {
        assertThatThrownBy(() -> ledgerService.recordTransaction(TransactionRequest.of(TransactionKind.BUY, "BTC",
                "Kraken", BigDecimal.ZERO, new BigDecimal("60000"), null, DAY_1)))
                .isInstanceOf(LedgerServiceException.class)
                .hasMessageContaining("quantity");
        assertThatThrownBy(() -> ledgerService.recordTransaction(TransactionRequest.of(TransactionKind.BUY, "BTC",
                "Kraken", BigDecimal.ONE, null, null, DAY_1)))
                .isInstanceOf(LedgerServiceException.class);
        assertThatThrownBy(() -> ledgerService.recordTransaction(TransactionRequest.of(null, "BTC",
                "Kraken", BigDecimal.ONE, BigDecimal.ONE, null, DAY_1)))
                .isInstanceOf(LedgerServiceException.class);
        assertThatThrownBy(() -> ledgerService.recordTransaction(TransactionRequest.of(TransactionKind.BUY, "BTC",
                "", BigDecimal.ONE, BigDecimal.ONE, null, DAY_1)))
                .isInstanceOf(LedgerServiceException.class);

        verifyNoInteractions(transactionRecordRepository, assetRepository, applicationEventPublisher);
    }

    @Test
    @DisplayName("trade inserts both legs, registers both assets as CRYPTO and re-projects both")
    void recordTrade() {
        when(assetRepository.findBySymbol(any())).thenReturn(Optional.empty());
        when(transactionRecordRepository.saveAll(ArgumentMatchers.<TransactionRecord>anyList()))
                .thenAnswer(inv -> inv.getArgument(0));

        TradeLegs legs = ledgerService.recordTrade(new TradeRequest("ETH", BigDecimal.ONE, "BTC",
                new BigDecimal("0.03"), "Kraken", null, null, DAY_1));

        assertThat(legs.outLeg().getAssetSymbol()).isEqualTo("ETH");
        assertThat(legs.inLeg().getAssetSymbol()).isEqualTo("BTC");
        assertThat(legs.outLeg().getCreatedAt()).isNotNull();

        ArgumentCaptor<Asset> assets = ArgumentCaptor.forClass(Asset.class);
        verify(assetRepository, times(2)).save(assets.capture());
        assertThat(assets.getAllValues()).extracting(Asset::getSymbol).containsExactly("ETH", "BTC");
        assertThat(assets.getAllValues()).extracting(Asset::getCategory).containsOnly(AssetCategory.CRYPTO);
        assertThat(assets.getAllValues()).extracting(Asset::getCurrentPrice).allMatch(p -> p.signum() == 0);
        verify(applicationEventPublisher).publishEvent(new LedgerMutatedEvent(Set.of("ETH", "BTC")));
    }

    @Test
    @DisplayName("delete of unknown id fails with TRANSACTION_NOT_FOUND")
    void deleteUnknown() {
        when(transactionRecordRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledgerService.deleteTransaction("nope"))
                .isInstanceOf(LedgerServiceException.class)
                .satisfies(e -> {
                    LedgerServiceException ex = (LedgerServiceException) e;
                    assertThat(ex.getErrorCode()).isEqualTo(LedgerServiceException.TRANSACTION_NOT_FOUND);
                    assertThat(ex.isNotFound()).isTrue();
                });
        verifyNoInteractions(applicationEventPublisher);
    }

    @Test
    @DisplayName("deleting one trade leg leaves the paired leg in place")
    void deleteOneLegDoesNotCascade() {
        TransactionRecord out = tradeOut("ETH", "1", "2024-01-01T10:00:00Z");
        out.setId("leg-out");
        out.setTradeGroupId("g1");
        when(transactionRecordRepository.findById("leg-out")).thenReturn(Optional.of(out));

        ledgerService.deleteTransaction("leg-out");

        verify(transactionRecordRepository).delete(out);
        verify(transactionRecordRepository, never()).findByTradeGroupId(any());
        verify(applicationEventPublisher).publishEvent(new LedgerMutatedEvent(Set.of("ETH")));
    }

    @Test
    @DisplayName("deleteTrade removes both legs and re-projects both assets")
    void deleteTrade() {
        TransactionRecord out = tradeOut("ETH", "1", "2024-01-01T10:00:00Z");
        TransactionRecord in = tradeIn("BTC", "0.03", "2024-01-01T10:00:00Z");
        when(transactionRecordRepository.findByTradeGroupId("g1")).thenReturn(List.of(out, in));

        List<TransactionRecord> deleted = ledgerService.deleteTrade("g1");

        assertThat(deleted).containsExactly(out, in);
        verify(transactionRecordRepository).deleteAll(List.of(out, in));
        verify(applicationEventPublisher).publishEvent(new LedgerMutatedEvent(Set.of("ETH", "BTC")));
    }

    @Test
    @DisplayName("deleteTrade of unknown group fails with TRANSACTION_NOT_FOUND")
    void deleteTradeUnknown() {
        when(transactionRecordRepository.findByTradeGroupId("g404")).thenReturn(List.of());

        assertThatThrownBy(() -> ledgerService.deleteTrade("g404"))
                .isInstanceOf(LedgerServiceException.class)
                .hasMessageContaining("g404");
        verify(transactionRecordRepository, never()).deleteAll(any());
    }

    @Test
    @DisplayName("plain buy leg is deleted without touching other legs")
    void deletePlainLeg() {
        TransactionRecord b = buy("BTC", "1", "100", "0", "2024-01-01T10:00:00Z");
        b.setId("b1");
        when(transactionRecordRepository.findById("b1")).thenReturn(Optional.of(b));

        assertThat(ledgerService.deleteTransaction("b1")).isSameAs(b);
        verify(applicationEventPublisher).publishEvent(new LedgerMutatedEvent(Set.of("BTC")));
    }
}
