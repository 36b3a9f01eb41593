package io.regstore.storage;

/**
 * Failure of the embedded engine: disk or file errors, a lock that could not be
 * acquired in time, or a structural conflict inside a bucket (a value written over a
 * nested bucket and vice versa).
 * <p>
 * Always fatal to the enclosing transaction.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
