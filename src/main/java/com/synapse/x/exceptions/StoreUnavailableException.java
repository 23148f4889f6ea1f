package com.synapse.x.exceptions;

/**
 * Transient storage failure: the LMDB environment is closed, full or failed an I/O call.
 * Reads on the ranking path retry on this exception before falling back to cached snapshots.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
