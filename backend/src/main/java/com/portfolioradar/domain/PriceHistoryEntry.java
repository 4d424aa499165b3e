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
 * Authoritative daily close for an asset: imported manually or cached from CoinGecko. Takes precedence over the
 * random-walk estimate when snapshots are built.
 */
@Document(collection = "price_history")
@CompoundIndex(name = "asset_price_date", def = "{'assetSymbol': 1, 'priceDate': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PriceHistoryEntry {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String assetSymbol;
    private LocalDate priceDate;
    private BigDecimal price;
    private PriceSource source;
    private Instant recordedAt;
}
