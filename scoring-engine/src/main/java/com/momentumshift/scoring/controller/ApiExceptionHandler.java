package com.momentumshift.scoring.controller;

import com.momentumshift.common.exception.MssException;
import com.momentumshift.scoring.dto.ErrorCode;
import com.momentumshift.scoring.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps domain errors to HTTP statuses: malformed input 400, insufficient history 422,
 * untrained model 409, unknown version 404, collaborator failure 502.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MssException.class)
    public ResponseEntity<ErrorResponse> handleDomain(MssException ex) {
        ErrorCode code = ErrorCode.of(ex);
        if (code == ErrorCode.COLLABORATOR_FAILURE) {
            log.error("Collaborator failure: {}", ex.getMessage(), ex);
        } else {
            log.warn("Request rejected. code={} reason={}", code, ex.getMessage());
        }
        return ResponseEntity.status(code.status()).body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex) {
        log.warn("Request rejected by framework. status={} reason={}", ex.getStatusCode(), ex.getReason());
        ErrorCode code = ex.getStatusCode().is4xxClientError() ? ErrorCode.INVALID_REQUEST : ErrorCode.INTERNAL_ERROR;
        return ResponseEntity.status(ex.getStatusCode()).body(ErrorResponse.of(code, ex.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.from(ex));
    }
}
