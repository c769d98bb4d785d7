package com.momentumshift.scoring.publisher;

import com.momentumshift.common.ledger.LedgerPublisher;
import com.momentumshift.common.ledger.WeightVersionEvent;
import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.model.MssResult;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.trace.RunContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * REST-based implementation of {@link LedgerPublisher}.
 *
 * <p>Posts to ledger-service fire-and-forget. No reactor thread is ever blocked and
 * a ledger outage is logged, never propagated to the scoring call.
 */
@Component
public class RestLedgerPublisher implements LedgerPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestLedgerPublisher.class);

    private final WebClient ledgerClient;

    public RestLedgerPublisher(WebClient ledgerClient) {
        this.ledgerClient = ledgerClient;
    }

    @Override
    public void publishResults(String runId, List<MssResult> results) {
        if (results.isEmpty()) return;
        ledgerClient.post()
            .uri("/api/v1/ledger/results")
            .header(RunContextUtil.RUN_ID_HEADER, runId)
            .bodyValue(results)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Results appended to ledger. runId={} count={} status={}",
                                runId, results.size(), r.getStatusCode()),
                err -> log.warn("Ledger append of results failed (non-critical). runId={} count={}",
                                runId, results.size(), err)
            );
    }

    @Override
    public void publishPredictions(String runId, List<PredictionRecord> records) {
        if (records.isEmpty()) return;
        ledgerClient.post()
            .uri("/api/v1/ledger/predictions")
            .header(RunContextUtil.RUN_ID_HEADER, runId)
            .bodyValue(records)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Predictions appended to ledger. runId={} count={} status={}",
                                runId, records.size(), r.getStatusCode()),
                err -> log.warn("Ledger append of predictions failed (non-critical). runId={} count={}",
                                runId, records.size(), err)
            );
    }

    @Override
    public void publishWeights(ComposerWeights weights, String reason) {
        ledgerClient.post()
            .uri("/api/v1/ledger/weights")
            .bodyValue(new WeightVersionEvent(weights, reason))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Weight version appended to ledger. version={} parent={} status={}",
                                weights.version(), weights.parentVersion(), r.getStatusCode()),
                err -> log.warn("Ledger append of weight version failed (non-critical). version={}",
                                weights.version(), err)
            );
    }
}
