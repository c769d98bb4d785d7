package com.momentumshift.common.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.momentumshift.common.model.ComposerWeights;

/** Ledger payload announcing a newly registered weight version and why it exists. */
public record WeightVersionEvent(
    @JsonProperty("weights") ComposerWeights weights,
    @JsonProperty("reason")  String reason
) {}
