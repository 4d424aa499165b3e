package com.portfolioradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Valuation of one asset on one calendar day. Written once by the backfill and never updated; the unique index on
 * (assetSymbol, snapshotDate) is what makes concurrent backfills safe.
 */
@Document(collection = "daily_snapshots")
@CompoundIndex(name = "asset_date", def = "{'assetSymbol': 1, 'snapshotDate': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DailySnapshot {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String assetSymbol;
    private LocalDate snapshotDate;
    private BigDecimal quantity;
    private BigDecimal pricePerUnit;
    private BigDecimal totalValue;
    private BigDecimal unrealizedPnl;
    private PriceSource priceSource;
    private Instant createdAt;
}
