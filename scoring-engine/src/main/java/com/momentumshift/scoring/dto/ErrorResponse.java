package com.momentumshift.scoring.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.momentumshift.common.exception.MalformedMomentException;
import com.momentumshift.common.exception.MalformedMomentException.FieldViolation;

import java.util.List;

/** Body of every non-2xx response and of failed batch entries. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    @JsonProperty("code")       ErrorCode code,
    @JsonProperty("message")    String message,
    @JsonProperty("violations") List<FieldViolation> violations
) {
    public ErrorResponse {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static ErrorResponse of(ErrorCode code, String message) {
        return new ErrorResponse(code, message, List.of());
    }

    public static ErrorResponse from(Throwable e) {
        ErrorCode code = ErrorCode.of(e);
        String message = code == ErrorCode.INTERNAL_ERROR ? "Unexpected error: " + e.getMessage() : e.getMessage();
        List<FieldViolation> violations = e instanceof MalformedMomentException malformed
            ? malformed.getViolations()
            : List.of();
        return new ErrorResponse(code, message, violations);
    }
}
