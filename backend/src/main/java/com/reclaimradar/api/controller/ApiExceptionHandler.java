package com.reclaimradar.api.controller;

import com.reclaimradar.api.dto.ErrorBody;
import com.reclaimradar.claims.lifecycle.ClaimLifecycleException;
import com.reclaimradar.claims.lifecycle.LedgerEventStatusException;
import com.reclaimradar.ingestion.sync.SyncAlreadyRunningException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps service exceptions and validation failures to ErrorBody responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + " is required")
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ClaimLifecycleException.class)
    public ResponseEntity<ErrorBody> handleClaimLifecycle(ClaimLifecycleException ex) {
        HttpStatus status = ClaimLifecycleException.CLAIM_NOT_FOUND.equals(ex.getErrorCode())
                ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(LedgerEventStatusException.class)
    public ResponseEntity<ErrorBody> handleLedgerEventStatus(LedgerEventStatusException ex) {
        HttpStatus status = LedgerEventStatusException.EVENT_NOT_FOUND.equals(ex.getErrorCode())
                ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(SyncAlreadyRunningException.class)
    public ResponseEntity<ErrorBody> handleSyncRunning(SyncAlreadyRunningException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.of("SYNC_IN_PROGRESS", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleBadArgument(IllegalArgumentException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }
}
