package com.prediction.market.options_market.persistence;

/**
 * A store operation failed. The ledger rolls back the in-memory change that
 * needed it.
 */
public class LedgerPersistenceException extends RuntimeException {

    public LedgerPersistenceException(String message) {
        super(message);
    }

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
