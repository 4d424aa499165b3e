package com.portfolioradar.ledger;

import lombok.Getter;

/**
 * Thrown by ledger mutations and snapshot backfill when a request is invalid or refers to something absent.
 * VALIDATION_ERROR is raised before the ledger is touched.
 */
@Getter
public class LedgerServiceException extends RuntimeException {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String TRANSACTION_NOT_FOUND = "TRANSACTION_NOT_FOUND";
    public static final String ASSET_NOT_FOUND = "ASSET_NOT_FOUND";

    private final String errorCode;

    public LedgerServiceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public static LedgerServiceException validation(String message) {
        return new LedgerServiceException(VALIDATION_ERROR, message);
    }

    public boolean isNotFound() {
        return TRANSACTION_NOT_FOUND.equals(errorCode) || ASSET_NOT_FOUND.equals(errorCode);
    }
}
