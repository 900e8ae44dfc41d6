package com.nayem.tenancy.store;

/**
 * Failure inside the transactional store, e.g. a uniqueness violation detected at commit.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
