package com.portfolioradar.ledger;

import com.portfolioradar.domain.AssetCategory;
import com.portfolioradar.domain.TransactionKind;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Input for recording a single ledger leg. assetName, category, apiSource and apiId only matter when the asset is
 * not yet in the registry. Null fees mean 0; null occurredAt means now.
 */
public record TransactionRequest(
        TransactionKind kind,
        String assetSymbol,
        String assetName,
        AssetCategory category,
        String apiSource,
        String apiId,
        String exchange,
        BigDecimal quantity,
        BigDecimal pricePerUnit,
        BigDecimal fees,
        String notes,
        Instant occurredAt
) {

    public static TransactionRequest of(TransactionKind kind, String assetSymbol, String exchange,
                                        BigDecimal quantity, BigDecimal pricePerUnit, BigDecimal fees,
                                        Instant occurredAt) {
        return new TransactionRequest(kind, assetSymbol, null, null, null, null, exchange,
                quantity, pricePerUnit, fees, null, occurredAt);
    }
}
