package com.ethnicthv.entitystore.core;

/**
 * Base unchecked exception for recoverable entity store failures.
 * Callers that handle a specific subclass can retry with corrected arguments; the store is
 * never left partially updated when one of these is thrown.
 */
public class EntityStoreException extends RuntimeException {
    public EntityStoreException(String message) {
        super(message);
    }

    public EntityStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
