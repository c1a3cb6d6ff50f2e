package com.quotagate.storage;

/**
 * A batched read, write or delete against the counter store did not complete.
 * Quota status is unknown when this is thrown: neither allowed nor denied.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
