package com.momentumshift.common.ledger;

import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.model.MssResult;
import com.momentumshift.common.model.PredictionRecord;

import java.util.List;

/**
 * Appends issued results, predictions and weight versions to the persistent ledger.
 *
 * <p>Implementations MUST be non-blocking (fire-and-forget or fully reactive); a ledger
 * outage must never fail a scoring call. No {@code .block()} inside any implementation.
 */
public interface LedgerPublisher {

    void publishResults(String runId, List<MssResult> results);

    void publishPredictions(String runId, List<PredictionRecord> records);

    void publishWeights(ComposerWeights weights, String reason);
}
