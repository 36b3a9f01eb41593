package io.regstore.core;

/**
 * The record shape supplied by a caller does not match what an operation needs:
 * unsupported component type, unknown field name, or a message-typed value found
 * on a field that is not declared as a message.
 * <p>
 * This is a programming error, not a data condition, and is never retried.
 */
public class SchemaException extends RuntimeException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
