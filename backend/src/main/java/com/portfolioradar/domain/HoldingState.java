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
 * Derived current position per asset. Recomputable from the ledger at any time; only exists while quantity &gt; 0.
 * costBasisEstimated marks rows whose avgCost and invested come from the market price instead of fiat flow.
 */
@Document(collection = "holdings")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class HoldingState {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String assetSymbol;
    private BigDecimal quantity;
    private BigDecimal avgCost;
    private BigDecimal invested;
    private BigDecimal marketPrice;
    private BigDecimal marketValue;
    private BigDecimal unrealizedPnl;
    private boolean costBasisEstimated;
    private Instant lastCalculatedAt;
}
