package com.portfolioradar.ledger;

import com.portfolioradar.domain.TransactionRecord;

import java.util.List;

/**
 * The two ledger records of one trade: TRADE_OUT of the given asset and TRADE_IN of the received one.
 */
public record TradeLegs(TransactionRecord outLeg, TransactionRecord inLeg) {

    public List<TransactionRecord> asList() {
        return List.of(outLeg, inLeg);
    }

    public String tradeGroupId() {
        return outLeg.getTradeGroupId();
    }
}
