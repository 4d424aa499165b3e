package com.portfolioradar.pricing;

/**
 * A quote source could not produce a price (timeout, HTTP error, unknown coin, unparseable payload).
 * Never escapes MarketPriceService: callers always get a fallback price.
 */
public class PriceUnavailableException extends RuntimeException {

    public PriceUnavailableException(String message) {
        super(message);
    }

    public PriceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
