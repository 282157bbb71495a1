package com.koni.product.domain.exception;

/**
 * Exception thrown when the producer connection cannot accept a record at publish time,
 * e.g. the producer has been closed or no broker metadata is available.
 */
public class ConnectionUnavailableException extends RuntimeException {

    public ConnectionUnavailableException(String message) {
        super(message);
    }

    public ConnectionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
