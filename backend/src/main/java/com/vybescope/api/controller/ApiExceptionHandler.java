package com.vybescope.api.controller;

import com.vybescope.api.dto.ErrorBody;
import com.vybescope.api.dto.ErrorCode;
import com.vybescope.ingestion.adapter.ProviderUnavailableException;
import com.vybescope.subscription.InvalidAddressException;
import com.vybescope.subscription.InvalidWhaleConfigException;
import com.vybescope.subscription.RegistryInvariantViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps domain and validation failures to {@link ErrorBody} responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        FieldError fieldError = ex.getFieldError();
        ErrorCode code = ErrorCode.fromConstraintMessage(fieldError != null ? fieldError.getDefaultMessage() : null);
        if (code != ErrorCode.VALIDATION_ERROR || fieldError == null) {
            return ResponseEntity.badRequest().body(ErrorBody.of(code));
        }
        return ResponseEntity.badRequest()
                .body(ErrorBody.of(code, fieldError.getField() + ": " + fieldError.getDefaultMessage()));
    }

    @ExceptionHandler(InvalidAddressException.class)
    public ResponseEntity<ErrorBody> handleInvalidAddress(InvalidAddressException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ErrorCode.INVALID_ADDRESS));
    }

    @ExceptionHandler(InvalidWhaleConfigException.class)
    public ResponseEntity<ErrorBody> handleInvalidWhaleConfig(InvalidWhaleConfigException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ErrorCode.INVALID_THRESHOLD, ex.getMessage()));
    }

    @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorBody> handleBadInput(Exception ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ErrorCode.INVALID_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<ErrorBody> handleProviderUnavailable(ProviderUnavailableException ex) {
        log.warn("Provider unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorBody.of(ErrorCode.PROVIDER_UNAVAILABLE));
    }

    @ExceptionHandler(RegistryInvariantViolationException.class)
    public ResponseEntity<ErrorBody> handleInvariantViolation(RegistryInvariantViolationException ex) {
        log.error("Registry invariant violated", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorBody.of(ErrorCode.INTERNAL_ERROR));
    }
}
