package com.koni.product.infrastructure.web.dto;

import lombok.Getter;

import java.time.Instant;

/**
 * Error body returned by the product endpoints.
 *
 * {@code error} names the failure kind (e.g. {@code MalformedVersion}, {@code DeliveryFailure})
 * so callers can tell a bad snapshot from a broker problem without parsing the message.
 */
@Getter
public class ErrorResponse {

    private final int status;
    private final String error;
    private final String message;
    private final Instant timestamp;

    public ErrorResponse(int status, ErrorKind error, String message) {
        this.status = status;
        this.error = error.getLabel();
        this.message = message;
        this.timestamp = Instant.now();
    }

    /**
     * Failure kinds reported to callers.
     */
    public enum ErrorKind {
        VALIDATION_FAILURE("ValidationFailure"),
        INVALID_REQUEST("InvalidRequest"),
        MALFORMED_VERSION("MalformedVersion"),
        DELIVERY_FAILURE("DeliveryFailure"),
        CONNECTION_UNAVAILABLE("ConnectionUnavailable"),
        SERIALIZATION_FAILURE("SerializationFailure"),
        INTERNAL_ERROR("InternalError");

        private final String label;

        ErrorKind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
