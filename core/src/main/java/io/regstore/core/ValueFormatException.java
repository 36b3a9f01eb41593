package io.regstore.core;

/**
 * A tagged buffer carries a known type tag but its payload cannot be decoded
 * (wrong length, unparsable protocol message, ...).
 */
public class ValueFormatException extends RuntimeException {

    public ValueFormatException(String message) {
        super(message);
    }

    public ValueFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
