package com.portfolioradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One ledger leg: a movement of a single asset. Source of truth for holdings and snapshots; never updated once
 * inserted (delete and re-project is the only correction path). All amounts are BigDecimal.
 * pricePerUnit and totalAmount are zero for trade legs; tradeGroupId links the two legs of one trade.
 */
@Document(collection = "transactions")
@CompoundIndex(name = "asset_occurred", def = "{'assetSymbol': 1, 'occurredAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TransactionRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private TransactionKind kind;
    private String assetSymbol;
    private BigDecimal quantity;
    private BigDecimal pricePerUnit;
    private BigDecimal totalAmount;
    private BigDecimal fees;
    @Indexed
    private Instant occurredAt;
    private String exchange;
    private String notes;
    @Indexed(sparse = true)
    private String tradeGroupId;
    private Instant createdAt;
}
