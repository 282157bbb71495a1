package com.koni.product.infrastructure.web.exception;

import com.koni.product.domain.exception.ConnectionUnavailableException;
import com.koni.product.domain.exception.DeliveryFailureException;
import com.koni.product.domain.exception.MalformedVersionException;
import com.koni.product.domain.exception.SerializationFailureException;
import com.koni.product.infrastructure.web.dto.ErrorResponse;
import com.koni.product.infrastructure.web.dto.ErrorResponse.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST API endpoints.
 * Maps publish failures to consistent error responses and HTTP status codes.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Returns 400 Bad Request when bean validation of the request body fails.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .sorted()
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", message);
        return badRequest(ErrorKind.VALIDATION_FAILURE, message);
    }

    /**
     * Returns 400 Bad Request when the body is missing or is not valid JSON.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return badRequest(ErrorKind.VALIDATION_FAILURE, "Malformed request body");
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return badRequest(ErrorKind.INVALID_REQUEST, ex.getMessage());
    }

    /**
     * Returns 400 Bad Request when the snapshot version cannot be parsed.
     */
    @ExceptionHandler(MalformedVersionException.class)
    public ResponseEntity<ErrorResponse> handleMalformedVersion(MalformedVersionException ex) {
        log.warn("Malformed version: {}", ex.getMessage());
        return badRequest(ErrorKind.MALFORMED_VERSION, ex.getMessage());
    }

    /**
     * Returns 503 Service Unavailable when Kafka did not accept the event.
     */
    @ExceptionHandler(DeliveryFailureException.class)
    public ResponseEntity<ErrorResponse> handleDeliveryFailure(DeliveryFailureException ex) {
        log.error("Delivery failure: {}", ex.getMessage(), ex);
        return serviceUnavailable(ErrorKind.DELIVERY_FAILURE);
    }

    /**
     * Returns 503 Service Unavailable when no producer connection is usable.
     */
    @ExceptionHandler(ConnectionUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleConnectionUnavailable(ConnectionUnavailableException ex) {
        log.error("Kafka connection unavailable: {}", ex.getMessage(), ex);
        return serviceUnavailable(ErrorKind.CONNECTION_UNAVAILABLE);
    }

    @ExceptionHandler(SerializationFailureException.class)
    public ResponseEntity<ErrorResponse> handleSerializationFailure(SerializationFailureException ex) {
        log.error("Serialization failure: {}", ex.getMessage(), ex);
        return internalServerError(ErrorKind.SERIALIZATION_FAILURE);
    }

    /**
     * Returns 500 Internal Server Error for anything not handled above.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        return internalServerError(ErrorKind.INTERNAL_ERROR);
    }

    private ResponseEntity<ErrorResponse> badRequest(ErrorKind kind, String message) {
        return respond(HttpStatus.BAD_REQUEST, kind, message);
    }

    private ResponseEntity<ErrorResponse> serviceUnavailable(ErrorKind kind) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, kind, "Service temporarily unavailable");
    }

    private ResponseEntity<ErrorResponse> internalServerError(ErrorKind kind) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, kind, "Internal server error");
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorKind kind, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), kind, message));
    }
}
