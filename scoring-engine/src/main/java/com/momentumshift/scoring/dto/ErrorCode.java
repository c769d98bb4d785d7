package com.momentumshift.scoring.dto;

import com.momentumshift.common.exception.CollaboratorException;
import com.momentumshift.common.exception.InsufficientHistoryException;
import com.momentumshift.common.exception.MalformedMomentException;
import com.momentumshift.common.exception.UnknownVersionException;
import com.momentumshift.common.exception.UntrainedModelException;
import org.springframework.http.HttpStatus;

/** Error taxonomy as seen by HTTP callers, one status per domain error type. */
public enum ErrorCode {
    MALFORMED_MOMENT(HttpStatus.BAD_REQUEST),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_HISTORY(HttpStatus.UNPROCESSABLE_ENTITY),
    UNTRAINED_MODEL(HttpStatus.CONFLICT),
    UNKNOWN_VERSION(HttpStatus.NOT_FOUND),
    COLLABORATOR_FAILURE(HttpStatus.BAD_GATEWAY),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }

    public static ErrorCode of(Throwable e) {
        if (e instanceof MalformedMomentException)     return MALFORMED_MOMENT;
        if (e instanceof InsufficientHistoryException) return INSUFFICIENT_HISTORY;
        if (e instanceof UntrainedModelException)      return UNTRAINED_MODEL;
        if (e instanceof UnknownVersionException)      return UNKNOWN_VERSION;
        if (e instanceof CollaboratorException)        return COLLABORATOR_FAILURE;
        if (e instanceof IllegalArgumentException)     return INVALID_REQUEST;
        return INTERNAL_ERROR;
    }
}
