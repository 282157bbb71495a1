package com.koni.product.domain.exception;

/**
 * Exception thrown when the broker rejects a product event or the send cannot be completed.
 * No retry is attempted by the publisher; the failure is surfaced to the caller.
 */
public class DeliveryFailureException extends RuntimeException {

    public DeliveryFailureException(String message) {
        super(message);
    }

    public DeliveryFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
