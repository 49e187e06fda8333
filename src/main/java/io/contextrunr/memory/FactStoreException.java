package io.contextrunr.memory;

/**
 * Raised when the fact store cannot be read or written.
 */
public class FactStoreException extends RuntimeException {

    public FactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
