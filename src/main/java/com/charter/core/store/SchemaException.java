package com.charter.core.store;

/**
 * Thrown when a stored record is malformed or misses a required field.
 * An unreadable store cannot be reasoned about, so this aborts the whole command.
 */
public class SchemaException extends RuntimeException {
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
