package com.prediction.market.options_market.service;

/**
 * Persisted ledger state that cannot be replayed into a valid book.
 */
public class LedgerStateException extends RuntimeException {

    public LedgerStateException(String message) {
        super(message);
    }
}
