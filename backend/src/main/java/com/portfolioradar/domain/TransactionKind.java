package com.portfolioradar.domain;

/**
 * Direction of a single-asset ledger movement. Closed set: every fold over the ledger switches on it exhaustively,
 * so a new kind fails compilation wherever quantity or fiat flow is summed.
 */
public enum TransactionKind {
    BUY,
    SELL,
    TRADE_IN,
    TRADE_OUT;

    public boolean isTradeLeg() {
        return this == TRADE_IN || this == TRADE_OUT;
    }
}
