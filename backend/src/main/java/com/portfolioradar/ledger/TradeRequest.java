package com.portfolioradar.ledger;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user-level trade: give up quantityFrom of assetFrom, receive quantityTo of assetTo. No fiat price involved.
 */
public record TradeRequest(
        String assetFrom,
        BigDecimal quantityFrom,
        String assetTo,
        BigDecimal quantityTo,
        String exchange,
        BigDecimal fees,
        String notes,
        Instant occurredAt
) {
}
