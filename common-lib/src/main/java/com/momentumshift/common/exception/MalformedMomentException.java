package com.momentumshift.common.exception;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised by the moment record builder when a raw event cannot be normalised.
 * Non-retriable: the same payload will always fail the same way.
 *
 * <p>Carries every violation found, not just the first, so callers can fix
 * the payload in one round trip.
 */
public class MalformedMomentException extends MssException {

    public enum Kind {
        MISSING_FIELD,
        OUT_OF_RANGE,
        INCONSISTENT_STATE
    }

    public record FieldViolation(
        @JsonProperty("field")  String field,
        @JsonProperty("kind")   Kind kind,
        @JsonProperty("detail") String detail
    ) {}

    private final List<FieldViolation> violations;

    public MalformedMomentException(String momentId, List<FieldViolation> violations) {
        super("MomentRecordBuilder", "Malformed moment id=" + momentId + " fields="
            + violations.stream().map(FieldViolation::field).collect(Collectors.joining(",")));
        this.violations = List.copyOf(violations);
    }

    /** Kind of the first violation; the most fundamental problem is always reported first. */
    public Kind getKind() {
        return violations.isEmpty() ? Kind.INCONSISTENT_STATE : violations.get(0).kind();
    }

    public List<String> getFields() {
        return violations.stream().map(FieldViolation::field).toList();
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
