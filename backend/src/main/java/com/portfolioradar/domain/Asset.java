package com.portfolioradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Asset registry entry. currentPrice is the latest known market price used by holdings projection; it is 0 for stub
 * entries created from trades until a quote arrives.
 */
@Document(collection = "assets")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Asset {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String symbol;
    private String name;
    private AssetCategory category;
    /** Quote source key, e.g. "coingecko"; "manual" for entries created from the ledger. */
    private String apiSource;
    /** Id at the quote source (CoinGecko coin id); defaults to the symbol. */
    private String apiId;
    private BigDecimal currentPrice;
    private Instant priceUpdatedAt;
    private Instant createdAt;
}
