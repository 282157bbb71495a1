package com.koni.product.domain.exception;

/**
 * Exception thrown when a product version string is not of the form {@code v<digits>}.
 * The event is never built in this case; the caller receives the failure as-is.
 */
public class MalformedVersionException extends RuntimeException {

    public MalformedVersionException(String message) {
        super(message);
    }

    public MalformedVersionException(String message, Throwable cause) {
        super(message, cause);
    }
}
