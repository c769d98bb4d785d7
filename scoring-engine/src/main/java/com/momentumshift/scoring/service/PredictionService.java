package com.momentumshift.scoring.service;

import com.momentumshift.common.ledger.LedgerPublisher;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.predict.OutcomePredictor;
import com.momentumshift.common.predict.VersionedModel;
import com.momentumshift.common.settings.MssSettings;
import com.momentumshift.common.trace.RunContextUtil;
import com.momentumshift.scoring.dto.PredictRequest;
import com.momentumshift.scoring.logger.PipelineStageLogger;
import com.momentumshift.scoring.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Issues a trajectory forecast for one MSS result against a resolved model version.
 * The model is resolved once per call, so a concurrent refit never changes the
 * version a prediction was made with.
 */
@Service
public class PredictionService {

    private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

    private final MssSettings settings;
    private final ModelRegistry modelRegistry;
    private final LedgerPublisher ledgerPublisher;
    private final PipelineStageLogger stageLogger;

    public PredictionService(MssSettings settings,
                             ModelRegistry modelRegistry,
                             LedgerPublisher ledgerPublisher,
                             PipelineStageLogger stageLogger) {
        this.settings        = settings;
        this.modelRegistry   = modelRegistry;
        this.ledgerPublisher = ledgerPublisher;
        this.stageLogger     = stageLogger;
    }

    public Mono<PredictionRecord> predict(PredictRequest request) {
        return Mono.defer(() -> {
                if (request == null || request.result() == null) {
                    return Mono.error(new IllegalArgumentException("result is required"));
                }
                VersionedModel model = modelRegistry.resolve(request.modelVersion());
                return Mono.just(OutcomePredictor.predict(request.result(), model, settings.prediction()));
            })
            .doOnEach(stageLogger.stage(PipelineStageLogger.PREDICTION_ISSUED, PredictionRecord::key))
            .flatMap(record -> RunContextUtil.currentRunId()
                .doOnNext(runId -> {
                    log.info("Prediction issued. momentId={} playerId={} modelVersion={} periods={} runId={}",
                             record.momentId(), record.playerId(), record.modelVersion(),
                             record.predicted().size(), runId);
                    ledgerPublisher.publishPredictions(runId, List.of(record));
                })
                .thenReturn(record));
    }
}
