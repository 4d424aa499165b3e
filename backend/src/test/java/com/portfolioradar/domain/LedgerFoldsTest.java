package com.portfolioradar.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static com.portfolioradar.domain.LedgerFixtures.buy;
import static com.portfolioradar.domain.LedgerFixtures.sell;
import static com.portfolioradar.domain.LedgerFixtures.tradeIn;
import static com.portfolioradar.domain.LedgerFixtures.tradeOut;
import static org.assertj.core.api.Assertions.assertThat;

class LedgerFoldsTest {

    @Test
    @DisplayName("signed quantity: inflows positive, outflows negative")
    void signedQuantity() {
        assertThat(LedgerFolds.signedQuantity(buy("BTC", "0.5", "60000", "10", "2024-01-01T10:00:00Z")))
                .isEqualByComparingTo("0.5");
        assertThat(LedgerFolds.signedQuantity(sell("BTC", "0.2", "70000", "5", "2024-01-02T10:00:00Z")))
                .isEqualByComparingTo("-0.2");
        assertThat(LedgerFolds.signedQuantity(tradeIn("BTC", "0.03", "2024-01-03T10:00:00Z")))
                .isEqualByComparingTo("0.03");
        assertThat(LedgerFolds.signedQuantity(tradeOut("ETH", "1", "2024-01-03T10:00:00Z")))
                .isEqualByComparingTo("-1");
    }

    @Test
    @DisplayName("fiat flow: buy adds fees, sell nets fees out, trade legs are zero")
    void fiatFlow() {
        assertThat(LedgerFolds.fiatFlow(buy("BTC", "0.5", "60000", "10", "2024-01-01T10:00:00Z")))
                .isEqualByComparingTo("30010");
        assertThat(LedgerFolds.fiatFlow(sell("BTC", "0.2", "70000", "5", "2024-01-02T10:00:00Z")))
                .isEqualByComparingTo("-13995");
        assertThat(LedgerFolds.fiatFlow(tradeIn("BTC", "0.03", "2024-01-03T10:00:00Z"))).isZero();
        assertThat(LedgerFolds.fiatFlow(tradeOut("ETH", "1", "2024-01-03T10:00:00Z"))).isZero();
    }

    @Test
    @DisplayName("fold sums quantity and fiat over all legs")
    void fold() {
        PositionTotals totals = LedgerFolds.fold(List.of(
                buy("BTC", "0.5", "60000", "10", "2024-01-01T10:00:00Z"),
                sell("BTC", "0.2", "70000", "5", "2024-01-02T10:00:00Z")));

        assertThat(totals.netQuantity()).isEqualByComparingTo("0.3");
        assertThat(totals.netInvestedFiat()).isEqualByComparingTo("16015");
        assertThat(totals.hasPosition()).isTrue();
    }

    @Test
    @DisplayName("oversold history clamps quantity to zero")
    void oversoldClamps() {
        PositionTotals totals = LedgerFolds.fold(List.of(
                buy("BTC", "0.1", "60000", "0", "2024-01-01T10:00:00Z"),
                sell("BTC", "0.4", "60000", "0", "2024-01-02T10:00:00Z")));

        assertThat(totals.netQuantity()).isEqualByComparingTo("-0.3");
        assertThat(totals.clampedQuantity()).isZero();
        assertThat(totals.hasPosition()).isFalse();
    }

    @Test
    @DisplayName("upToDate keeps legs on or before the calendar day in the given zone, in replay order")
    void upToDateCutsByCalendarDay() {
        TransactionRecord lateOnFirst = buy("BTC", "1", "100", "0", "2024-01-01T23:30:00Z");
        TransactionRecord early = buy("BTC", "2", "100", "0", "2024-01-01T01:00:00Z");
        TransactionRecord second = buy("BTC", "3", "100", "0", "2024-01-02T00:30:00Z");

        List<TransactionRecord> utc = LedgerFolds.upToDate(List.of(second, lateOnFirst, early),
                LocalDate.of(2024, 1, 1), ZoneOffset.UTC);
        assertThat(utc).containsExactly(early, lateOnFirst);

        // 23:30Z is already Jan 2 in Berlin
        List<TransactionRecord> berlin = LedgerFolds.upToDate(List.of(second, lateOnFirst, early),
                LocalDate.of(2024, 1, 1), ZoneId.of("Europe/Berlin"));
        assertThat(berlin).containsExactly(early);
    }

    @Test
    @DisplayName("replay order breaks occurredAt ties by createdAt")
    void replayOrderTieBreak() {
        TransactionRecord a = buy("BTC", "1", "100", "0", "2024-01-01T10:00:00Z");
        TransactionRecord b = sell("BTC", "1", "100", "0", "2024-01-01T10:00:00Z");
        a.setCreatedAt(Instant.parse("2024-02-01T00:00:00Z"));
        b.setCreatedAt(Instant.parse("2024-01-15T00:00:00Z"));

        assertThat(LedgerFolds.inReplayOrder(List.of(a, b))).containsExactly(b, a);
    }
}
