package com.momentumshift.scoring.service;

import com.momentumshift.common.calibration.Calibrator;
import com.momentumshift.common.calibration.Evaluator;
import com.momentumshift.common.calibration.RefitResult;
import com.momentumshift.common.ledger.LedgerPublisher;
import com.momentumshift.common.model.CalibrationReport;
import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.model.ObservedOutcome;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.predict.TrajectoryModel;
import com.momentumshift.common.predict.TrajectoryTrainer;
import com.momentumshift.common.predict.VersionedModel;
import com.momentumshift.common.settings.MssSettings;
import com.momentumshift.common.trace.RunContextUtil;
import com.momentumshift.scoring.client.GroundTruthClient;
import com.momentumshift.scoring.dto.EvaluateRequest;
import com.momentumshift.scoring.dto.RefitRequest;
import com.momentumshift.scoring.dto.TrainRequest;
import com.momentumshift.scoring.logger.PipelineStageLogger;
import com.momentumshift.scoring.registry.ModelRegistry;
import com.momentumshift.scoring.registry.WeightRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Evaluation, refit and initial training.
 *
 * <p>Refit is copy-on-write: parent versions are resolved once, the new weight and
 * model versions are computed off the event loop, and only then registered. Nothing
 * already issued under a parent version is touched.
 */
@Service
public class CalibrationService {

    private static final Logger log = LoggerFactory.getLogger(CalibrationService.class);

    private final MssSettings settings;
    private final WeightRegistry weightRegistry;
    private final ModelRegistry modelRegistry;
    private final TrajectoryTrainer trainer;
    private final GroundTruthClient groundTruthClient;
    private final LedgerPublisher ledgerPublisher;
    private final PipelineStageLogger stageLogger;
    private final Clock clock;

    public CalibrationService(MssSettings settings,
                              WeightRegistry weightRegistry,
                              ModelRegistry modelRegistry,
                              TrajectoryTrainer trainer,
                              GroundTruthClient groundTruthClient,
                              LedgerPublisher ledgerPublisher,
                              PipelineStageLogger stageLogger,
                              Clock clock) {
        this.settings          = settings;
        this.weightRegistry    = weightRegistry;
        this.modelRegistry     = modelRegistry;
        this.trainer           = trainer;
        this.groundTruthClient = groundTruthClient;
        this.ledgerPublisher   = ledgerPublisher;
        this.stageLogger       = stageLogger;
        this.clock             = clock;
    }

    public Mono<CalibrationReport> evaluate(EvaluateRequest request) {
        return RunContextUtil.currentRunId().flatMap(runId ->
            outcomes(request.records(), request.outcomes(), runId)
                .flatMap(outcomes -> Mono.fromCallable(() -> Evaluator.evaluate(request.records(), outcomes))
                    .subscribeOn(Schedulers.boundedElastic()))
                .doOnEach(stageLogger.stage(PipelineStageLogger.BATCH_EVALUATED,
                    report -> "evaluated=" + report.evaluatedCount()))
                .doOnNext(report -> {
                    log.info("Batch evaluated. batchSize={} evaluated={} mae={} correlation={} issues={} runId={}",
                             report.batchSize(), report.evaluatedCount(), report.meanAbsoluteError(),
                             report.scoreChangeCorrelation(), report.issues().size(), runId);
                    ledgerPublisher.publishPredictions(runId, report.evaluated());
                }));
    }

    public Mono<RefitResult> refit(RefitRequest request) {
        return Mono.defer(() -> {
            ComposerWeights parentWeights = weightRegistry.resolve(request.weightVersion());
            VersionedModel parentModel    = modelRegistry.resolve(request.modelVersion());
            return RunContextUtil.currentRunId().flatMap(runId ->
                outcomes(request.records(), request.outcomes(), runId)
                    .flatMap(outcomes -> Mono.fromCallable(() -> Calibrator.refit(
                            request.records(), outcomes,
                            parentWeights, weightRegistry.nextVersion(),
                            parentModel.version(), modelRegistry.nextVersion(),
                            trainer, settings.prediction(), Instant.now(clock)))
                        .subscribeOn(Schedulers.boundedElastic()))
                    .doOnNext(result -> register(result, runId))
                    .doOnEach(stageLogger.stage(PipelineStageLogger.WEIGHTS_REFIT,
                        result -> result.weights().version())));
        });
    }

    public Mono<VersionedModel> train(TrainRequest request) {
        return Mono.defer(() -> {
            String parent = request.parentVersion() == null
                ? modelRegistry.current().version()
                : modelRegistry.get(request.parentVersion()).version();
            return Mono.fromCallable(() -> trainer.fit(request.examples(), settings.prediction()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(model -> modelRegistry.register(
                    new VersionedModel(modelRegistry.nextVersion(), parent, model, Instant.now(clock))))
                .doOnNext(registered -> log.info(
                    "Model trained. version={} parent={} samples={} horizon={}",
                    registered.version(), parent, registered.sampleCount(), registered.horizon()));
        });
    }

    public List<ComposerWeights> weightVersions() {
        return weightRegistry.all();
    }

    public List<VersionedModel> modelVersions() {
        return modelRegistry.all();
    }

    private void register(RefitResult result, String runId) {
        weightRegistry.register(result.weights());
        ledgerPublisher.publishWeights(result.weights(),
            "refit from " + result.report().evaluatedCount() + " evaluated predictions");
        if (result.model() != null) {
            modelRegistry.register(result.model());
        }
        ledgerPublisher.publishPredictions(runId, result.report().evaluated());
        log.info("Refit registered. weightVersion={} parent={} w1={} w2={} modelVersion={} issues={} runId={}",
                 result.weights().version(), result.weights().parentVersion(),
                 result.weights().w1(), result.weights().w2(),
                 result.model() == null ? "none" : result.model().version(),
                 result.issues().size(), runId);
    }

    private Mono<List<ObservedOutcome>> outcomes(List<PredictionRecord> records,
                                                 List<ObservedOutcome> supplied, String runId) {
        if (supplied != null) {
            return Mono.just(supplied);
        }
        return groundTruthClient.fetch(records, settings.prediction().horizon(), runId);
    }
}
