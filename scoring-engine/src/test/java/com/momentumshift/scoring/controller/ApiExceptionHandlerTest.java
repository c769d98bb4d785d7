package com.momentumshift.scoring.controller;

import com.momentumshift.common.context.StagedContextMultiplier;
import com.momentumshift.common.model.InsufficientHistoryPolicy;
import com.momentumshift.common.model.PlayerHistory;
import com.momentumshift.common.predict.RidgeTrajectoryTrainer;
import com.momentumshift.common.settings.MssSettings;
import com.momentumshift.scoring.RecordingLedgerPublisher;
import com.momentumshift.scoring.ScoringFixtures;
import com.momentumshift.scoring.StubWebClients;
import com.momentumshift.scoring.client.GroundTruthClient;
import com.momentumshift.scoring.client.PlayerHistoryClient;
import com.momentumshift.scoring.client.SentimentClient;
import com.momentumshift.scoring.dto.PredictRequest;
import com.momentumshift.scoring.dto.ScoreRequest;
import com.momentumshift.scoring.logger.PipelineStageLogger;
import com.momentumshift.scoring.registry.ModelRegistry;
import com.momentumshift.scoring.registry.WeightRegistry;
import com.momentumshift.scoring.service.CalibrationService;
import com.momentumshift.scoring.service.MomentScoringService;
import com.momentumshift.scoring.service.PredictionService;
import com.momentumshift.scoring.service.RealizedShiftService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** HTTP status mapping of the domain error taxonomy, exercised end to end through the controllers. */
class ApiExceptionHandlerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        MssSettings settings = ScoringFixtures.settings(InsufficientHistoryPolicy.FAIL);
        RecordingLedgerPublisher ledger = new RecordingLedgerPublisher();
        PipelineStageLogger stageLogger = new PipelineStageLogger();
        WeightRegistry weights = new WeightRegistry(ScoringFixtures.weights());
        ModelRegistry models = new ModelRegistry(CLOCK);
        WebClient brokenHistory = StubWebClients.json(HttpStatus.INTERNAL_SERVER_ERROR, "{}");
        WebClient noSentiment = StubWebClients.json(HttpStatus.OK, "[]");

        MomentScoringService scoring = new MomentScoringService(settings, weights,
            new StagedContextMultiplier(settings.multiplier()),
            new PlayerHistoryClient(brokenHistory), new SentimentClient(noSentiment), ledger, stageLogger);
        PredictionService prediction = new PredictionService(settings, models, ledger, stageLogger);
        CalibrationService calibration = new CalibrationService(settings, weights, models,
            new RidgeTrajectoryTrainer(), new GroundTruthClient(noSentiment), ledger, stageLogger, CLOCK);

        client = WebTestClient
            .bindToController(
                new ScoringController(scoring, prediction, new RealizedShiftService()),
                new CalibrationController(calibration))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("malformed moment maps to 400 with field diagnostics")
    void malformed() {
        client.post().uri("/api/v1/moments")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(ScoringFixtures.event("m-001", null))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.code").isEqualTo("MALFORMED_MOMENT")
            .jsonPath("$.violations[0].field").isEqualTo("batterId")
            .jsonPath("$.violations[0].kind").isEqualTo("MISSING_FIELD");
    }

    @Test
    @DisplayName("insufficient history maps to 422")
    void insufficientHistory() {
        Map<String, PlayerHistory> histories = new HashMap<>(ScoringFixtures.histories());
        histories.put("pitcher-1", PlayerHistory.empty("pitcher-1"));

        client.post().uri("/api/v1/score")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new ScoreRequest(ScoringFixtures.homeRun("m-001"), histories, List.of(), null))
            .exchange()
            .expectStatus().isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY)
            .expectBody()
            .jsonPath("$.code").isEqualTo("INSUFFICIENT_HISTORY");
    }

    @Test
    @DisplayName("untrained model maps to 409")
    void untrained() {
        client.post().uri("/api/v1/predict")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new PredictRequest(ScoringFixtures.result("m-001", 0.3, 0.1, 0.3), null))
            .exchange()
            .expectStatus().isEqualTo(HttpStatus.CONFLICT)
            .expectBody()
            .jsonPath("$.code").isEqualTo("UNTRAINED_MODEL");
    }

    @Test
    @DisplayName("unknown version maps to 404")
    void unknownVersion() {
        client.post().uri("/api/v1/predict")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new PredictRequest(ScoringFixtures.result("m-001", 0.3, 0.1, 0.3), "model-v5"))
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.code").isEqualTo("UNKNOWN_VERSION");
    }

    @Test
    @DisplayName("collaborator failure maps to 502")
    void collaborator() {
        client.post().uri("/api/v1/score")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new ScoreRequest(ScoringFixtures.homeRun("m-001"), null, null, null))
            .exchange()
            .expectStatus().isEqualTo(HttpStatus.BAD_GATEWAY)
            .expectBody()
            .jsonPath("$.code").isEqualTo("COLLABORATOR_FAILURE");
    }

    @Test
    @DisplayName("version listings start from the seeded versions")
    void versions() {
        client.get().uri("/api/v1/versions/weights")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].version").isEqualTo("weights-v1")
            .jsonPath("$[0].w1").isEqualTo(60.0);

        client.get().uri("/api/v1/versions/models")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].version").isEqualTo("model-v0")
            .jsonPath("$[0].trained").isEqualTo(false);
    }

    @Test
    @DisplayName("realized shift without data is neutral and unavailable")
    void realizedShiftNeutral() {
        client.post().uri("/api/v1/realized-shift")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("playerId", "batter-1", "role", "BATTER"))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.available").isEqualTo(false)
            .jsonPath("$.score").isEqualTo(50.0);
    }
}
