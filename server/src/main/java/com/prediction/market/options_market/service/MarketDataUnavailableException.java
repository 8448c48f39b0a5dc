package com.prediction.market.options_market.service;

/**
 * No quote set has been published yet, so nothing can be priced.
 */
public class MarketDataUnavailableException extends RuntimeException {

    public MarketDataUnavailableException(String message) {
        super(message);
    }
}
