package com.momentumshift.scoring.service;

import com.momentumshift.common.exception.CollaboratorException;
import com.momentumshift.common.exception.UnknownVersionException;
import com.momentumshift.common.model.CalibrationIssue.Code;
import com.momentumshift.common.model.InsufficientHistoryPolicy;
import com.momentumshift.common.model.ObservedOutcome;
import com.momentumshift.common.model.PredictionRecord;
import com.momentumshift.common.model.PredictionStatus;
import com.momentumshift.common.model.TrainingExample;
import com.momentumshift.common.predict.RidgeTrajectoryTrainer;
import com.momentumshift.common.trace.RunContextUtil;
import com.momentumshift.scoring.RecordingLedgerPublisher;
import com.momentumshift.scoring.ScoringFixtures;
import com.momentumshift.scoring.StubWebClients;
import com.momentumshift.scoring.client.GroundTruthClient;
import com.momentumshift.scoring.dto.EvaluateRequest;
import com.momentumshift.scoring.dto.RefitRequest;
import com.momentumshift.scoring.dto.TrainRequest;
import com.momentumshift.scoring.logger.PipelineStageLogger;
import com.momentumshift.scoring.registry.ModelRegistry;
import com.momentumshift.scoring.registry.WeightRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CalibrationServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);

    private final RecordingLedgerPublisher ledger = new RecordingLedgerPublisher();
    private WeightRegistry weightRegistry;
    private ModelRegistry modelRegistry;

    private final List<PredictionRecord> records = new ArrayList<>();
    private final List<ObservedOutcome> outcomes = new ArrayList<>();

    @BeforeEach
    void setUp() {
        weightRegistry = new WeightRegistry(ScoringFixtures.weights());
        modelRegistry  = new ModelRegistry(CLOCK);
        for (int i = 0; i < 6; i++) {
            double s = -0.4 + 0.15 * i;
            double n = (i % 3) * 0.3 - 0.3;
            String id = "m-" + i;
            records.add(ScoringFixtures.prediction(id, s, n, 0.300));
            outcomes.add(ScoringFixtures.outcome(id, 0.300, 0.03 * s + 0.01 * n * 1.2));
        }
    }

    private CalibrationService service(WebClient groundTruth) {
        return new CalibrationService(ScoringFixtures.settings(InsufficientHistoryPolicy.FAIL),
            weightRegistry, modelRegistry, new RidgeTrajectoryTrainer(),
            new GroundTruthClient(groundTruth), ledger, new PipelineStageLogger(), CLOCK);
    }

    private CalibrationService offline() {
        return service(StubWebClients.failing(new IOException("ground truth must not be called")));
    }

    @Test
    @DisplayName("evaluation with supplied outcomes reports error metrics and publishes evaluated records")
    void evaluatesSupplied() {
        StepVerifier.create(RunContextUtil.withRunId(
                offline().evaluate(new EvaluateRequest(records, outcomes)), "run-1"))
            .assertNext(report -> {
                assertEquals(6, report.batchSize());
                assertEquals(6, report.evaluatedCount());
                assertNotNull(report.meanAbsoluteError());
                assertNotNull(report.scoreChangeCorrelation());
                assertTrue(report.evaluated().stream().allMatch(r -> r.status() == PredictionStatus.EVALUATED));
            })
            .verifyComplete();

        assertEquals(6, ledger.predictions.size());
    }

    @Test
    @DisplayName("outcomes are read from the ground-truth source when not supplied")
    void fetchesOutcomes() {
        WebClient groundTruth = StubWebClients.json(HttpStatus.OK,
            "[{\"momentId\":\"m-0\",\"playerId\":\"batter-1\",\"observed\":[0.29,0.29,0.29]}]");

        StepVerifier.create(service(groundTruth).evaluate(new EvaluateRequest(records, null)))
            .assertNext(report -> {
                assertEquals(1, report.evaluatedCount());
                assertTrue(report.hasIssue(Code.MISSING_OUTCOME));
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("a failing ground-truth source fails evaluation with a typed error")
    void groundTruthFailure() {
        StepVerifier.create(service(StubWebClients.json(HttpStatus.SERVICE_UNAVAILABLE, "{}"))
                .evaluate(new EvaluateRequest(records, null)))
            .expectError(CollaboratorException.class)
            .verify();
    }

    @Test
    @DisplayName("refit registers new weight and model versions and leaves the parents untouched")
    void refitIsCopyOnWrite() {
        StepVerifier.create(offline().refit(new RefitRequest(records, outcomes, null, null)))
            .assertNext(result -> {
                assertEquals("weights-v2", result.weights().version());
                assertEquals("weights-v1", result.weights().parentVersion());
                assertNotNull(result.model());
                assertEquals("model-v1", result.model().version());
                assertEquals("model-v0", result.model().parentVersion());
            })
            .verifyComplete();

        assertEquals("weights-v2", weightRegistry.current().version());
        assertEquals("model-v1", modelRegistry.current().version());
        assertEquals(60.0, weightRegistry.get("weights-v1").w1());
        assertFalse(modelRegistry.get("model-v0").trained());
        assertEquals(1, ledger.weights.size());
        assertTrue(records.stream().allMatch(r -> r.status() == PredictionStatus.PREDICTED));
    }

    @Test
    @DisplayName("refit against an unknown parent version is a typed error and registers nothing")
    void refitUnknownParent() {
        StepVerifier.create(offline().refit(new RefitRequest(records, outcomes, "weights-v9", null)))
            .expectError(UnknownVersionException.class)
            .verify();

        assertEquals(1, weightRegistry.all().size());
    }

    @Test
    @DisplayName("initial training registers a trained model derived from the current version")
    void trains() {
        List<TrainingExample> examples = records.stream()
            .map(r -> new TrainingExample(r.features(), List.of(0.31, 0.30, 0.32)))
            .toList();

        StepVerifier.create(offline().train(new TrainRequest(examples, null)))
            .assertNext(model -> {
                assertEquals("model-v1", model.version());
                assertEquals("model-v0", model.parentVersion());
                assertTrue(model.trained());
                assertEquals(6, model.sampleCount());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("training on too few samples is rejected and registers nothing")
    void trainTooFew() {
        List<TrainingExample> examples = List.of(new TrainingExample(records.get(0).features(), List.of(0.3)));

        StepVerifier.create(offline().train(new TrainRequest(examples, null)))
            .expectError(IllegalArgumentException.class)
            .verify();

        assertEquals(1, modelRegistry.all().size());
    }
}
