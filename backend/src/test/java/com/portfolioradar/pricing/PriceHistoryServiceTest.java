package com.portfolioradar.pricing;

import com.portfolioradar.domain.PriceHistoryEntry;
import com.portfolioradar.domain.PriceHistoryRepository;
import com.portfolioradar.domain.PriceSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PriceHistoryServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 2, 1);

    @Mock
    PriceHistoryRepository priceHistoryRepository;

    @InjectMocks
    PriceHistoryService service;

    @Test
    @DisplayName("record inserts a MANUAL price for a new day")
    void recordNew() {
        when(priceHistoryRepository.findByAssetSymbolAndPriceDate("BTC", DAY)).thenReturn(Optional.empty());
        when(priceHistoryRepository.save(any(PriceHistoryEntry.class))).thenAnswer(inv -> inv.getArgument(0));

        PriceHistoryEntry saved = service.record("btc", DAY, new BigDecimal("43000"));

        assertThat(saved.getAssetSymbol()).isEqualTo("BTC");
        assertThat(saved.getSource()).isEqualTo(PriceSource.MANUAL);
        assertThat(saved.getPrice()).isEqualByComparingTo("43000");
    }

    @Test
    @DisplayName("record overwrites an existing day, including a cached CoinGecko price")
    void recordOverwrites() {
        PriceHistoryEntry existing = new PriceHistoryEntry();
        existing.setId("p1");
        existing.setSource(PriceSource.COINGECKO);
        existing.setPrice(new BigDecimal("42000"));
        when(priceHistoryRepository.findByAssetSymbolAndPriceDate("BTC", DAY)).thenReturn(Optional.of(existing));
        when(priceHistoryRepository.save(existing)).thenReturn(existing);

        PriceHistoryEntry saved = service.record("BTC", DAY, new BigDecimal("43000"));

        assertThat(saved.getId()).isEqualTo("p1");
        assertThat(saved.getSource()).isEqualTo(PriceSource.MANUAL);
        assertThat(saved.getPrice()).isEqualByComparingTo("43000");
    }

    @Test
    @DisplayName("invalid input is rejected before storage")
    void rejectsInvalid() {
        assertThatThrownBy(() -> service.record(" ", DAY, BigDecimal.ONE)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.record("BTC", null, BigDecimal.ONE)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.record("BTC", DAY, new BigDecimal("-1")))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(priceHistoryRepository);
    }
}
