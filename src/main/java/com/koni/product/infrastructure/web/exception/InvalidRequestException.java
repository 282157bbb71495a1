package com.koni.product.infrastructure.web.exception;

/**
 * Exception thrown when a request is well-formed JSON but inconsistent with its path,
 * e.g. a body id that differs from the id in the URL.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
