package com.rymharvest.scraper;

/**
 * Raised when the entity store cannot complete a read or write.
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
