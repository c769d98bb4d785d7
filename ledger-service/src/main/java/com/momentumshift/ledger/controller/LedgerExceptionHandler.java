package com.momentumshift.ledger.controller;

import com.momentumshift.common.exception.UnknownVersionException;
import com.momentumshift.ledger.dto.LedgerError;
import com.momentumshift.ledger.service.LedgerConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class LedgerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LedgerExceptionHandler.class);

    @ExceptionHandler(LedgerConflictException.class)
    public ResponseEntity<LedgerError> conflict(LedgerConflictException e) {
        log.warn("Ledger append refused. reason={}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new LedgerError("CONFLICT", e.getMessage()));
    }

    @ExceptionHandler(UnknownVersionException.class)
    public ResponseEntity<LedgerError> unknownVersion(UnknownVersionException e) {
        log.warn("Ledger lookup missed. version={}", e.getVersion());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new LedgerError("UNKNOWN_VERSION", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<LedgerError> badRequest(IllegalArgumentException e) {
        log.warn("Invalid ledger request. reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(new LedgerError("INVALID_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<LedgerError> status(ResponseStatusException e) {
        return ResponseEntity.status(e.getStatusCode())
            .body(new LedgerError(HttpStatus.valueOf(e.getStatusCode().value()).name(), e.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<LedgerError> unexpected(Exception e) {
        log.error("Unhandled ledger error", e);
        return ResponseEntity.internalServerError().body(new LedgerError("INTERNAL_ERROR", e.getMessage()));
    }
}
