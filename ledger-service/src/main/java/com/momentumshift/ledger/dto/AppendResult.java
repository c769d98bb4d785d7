package com.momentumshift.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of an append request. {@code duplicates} were already present and are
 * accepted idempotently; {@code rejected} would have rewritten history (a second
 * evaluation) and were refused.
 */
public record AppendResult(
    @JsonProperty("appended")   int appended,
    @JsonProperty("duplicates") List<String> duplicates,
    @JsonProperty("rejected")   List<String> rejected
) {
    public AppendResult {
        duplicates = duplicates == null ? List.of() : List.copyOf(duplicates);
        rejected   = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public boolean hasConflicts() {
        return !rejected.isEmpty();
    }
}
