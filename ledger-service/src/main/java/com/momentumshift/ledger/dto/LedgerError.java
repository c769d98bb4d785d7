package com.momentumshift.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LedgerError(
    @JsonProperty("code")    String code,
    @JsonProperty("message") String message
) {}
