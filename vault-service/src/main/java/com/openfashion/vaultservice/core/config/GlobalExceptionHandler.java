package com.openfashion.vaultservice.core.config;

import com.openfashion.vaultservice.core.exceptions.*;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UnauthorizedCallerException.class)
    public ResponseEntity<Object> handleUnauthorized(UnauthorizedCallerException ex) {
        return buildResponse(HttpStatus.FORBIDDEN, "UNAUTHORIZED_CALLER", ex.getMessage());
    }

    @ExceptionHandler(TransactionNotFoundException.class)
    public ResponseEntity<Object> handleTxNotFound(TransactionNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "TRANSACTION_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(SubscriptionNotFoundException.class)
    public ResponseEntity<Object> handleSubscriptionNotFound(SubscriptionNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "SUBSCRIPTION_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(OwnerNotFoundException.class)
    public ResponseEntity<Object> handleOwnerNotFound(OwnerNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "OWNER_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(StateConflictException.class)
    public ResponseEntity<Object> handleConflict(StateConflictException ex) {
        return buildResponse(HttpStatus.CONFLICT, "STATE_CONFLICT", ex.getMessage());
    }

    @ExceptionHandler(InvalidOwnerConfigurationException.class)
    public ResponseEntity<Object> handleOwnerConfiguration(InvalidOwnerConfigurationException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_OWNER_CONFIGURATION", ex.getMessage());
    }

    @ExceptionHandler(InvalidSubscriptionMetadataException.class)
    public ResponseEntity<Object> handleMetadata(InvalidSubscriptionMetadataException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_SUBSCRIPTION_METADATA", ex.getMessage());
    }

    @ExceptionHandler(UnsupportedSettlementVariantException.class)
    public ResponseEntity<Object> handleVariant(UnsupportedSettlementVariantException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "UNSUPPORTED_SETTLEMENT_VARIANT", ex.getMessage());
    }

    @ExceptionHandler(InvalidValueException.class)
    public ResponseEntity<Object> handleInvalidValue(InvalidValueException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_VALUE", ex.getMessage());
    }

    @ExceptionHandler(VaultNotInitializedException.class)
    public ResponseEntity<Object> handleNotInitialized(VaultNotInitializedException ex) {
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, "VAULT_NOT_INITIALIZED", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Object> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return buildResponse(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleUnreadable(HttpMessageNotReadableException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be read");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Object> handleMissingHeader(MissingRequestHeaderException ex) {
        return buildResponse(HttpStatus.FORBIDDEN, "UNAUTHORIZED_CALLER", "Missing header " + ex.getHeaderName());
    }

    private ResponseEntity<Object> buildResponse(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
