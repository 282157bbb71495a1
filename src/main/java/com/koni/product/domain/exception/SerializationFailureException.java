package com.koni.product.domain.exception;

/**
 * Exception thrown when a product event cannot be encoded to its JSON wire form.
 */
public class SerializationFailureException extends RuntimeException {

    public SerializationFailureException(String message) {
        super(message);
    }

    public SerializationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
