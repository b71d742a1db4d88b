package com.elssolution.energymonitor.store;

/** A reading could not be persisted. Transient from the caller's point of view. */
public class StoreWriteException extends RuntimeException {

    public StoreWriteException(String message) {
        super(message);
    }

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
