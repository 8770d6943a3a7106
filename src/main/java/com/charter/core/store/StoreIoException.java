package com.charter.core.store;

/**
 * Thrown when the filesystem backing the store cannot be read or written.
 */
public class StoreIoException extends RuntimeException {
    public StoreIoException(String message) {
        super(message);
    }

    public StoreIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
