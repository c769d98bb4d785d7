package com.momentumshift.scoring.service;

import com.momentumshift.common.context.StagedContextMultiplier;
import com.momentumshift.common.exception.CollaboratorException;
import com.momentumshift.common.exception.InsufficientHistoryException;
import com.momentumshift.common.exception.MalformedMomentException;
import com.momentumshift.common.exception.UnknownVersionException;
import com.momentumshift.common.model.InsufficientHistoryPolicy;
import com.momentumshift.common.model.MssResult;
import com.momentumshift.common.model.PlayerHistory;
import com.momentumshift.common.model.PlayerRole;
import com.momentumshift.common.settings.MssSettings;
import com.momentumshift.common.trace.RunContextUtil;
import com.momentumshift.scoring.RecordingLedgerPublisher;
import com.momentumshift.scoring.ScoringFixtures;
import com.momentumshift.scoring.StubWebClients;
import com.momentumshift.scoring.client.PlayerHistoryClient;
import com.momentumshift.scoring.client.SentimentClient;
import com.momentumshift.scoring.dto.BatchScoreRequest;
import com.momentumshift.scoring.dto.ErrorCode;
import com.momentumshift.scoring.dto.MomentScoreEntry;
import com.momentumshift.scoring.dto.ScoreRequest;
import com.momentumshift.scoring.logger.PipelineStageLogger;
import com.momentumshift.scoring.registry.WeightRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MomentScoringServiceTest {

    private final RecordingLedgerPublisher ledger = new RecordingLedgerPublisher();

    private MomentScoringService service(InsufficientHistoryPolicy policy, WebClient history, WebClient sentiment) {
        MssSettings settings = ScoringFixtures.settings(policy);
        return new MomentScoringService(settings,
            new WeightRegistry(ScoringFixtures.weights()),
            new StagedContextMultiplier(settings.multiplier()),
            new PlayerHistoryClient(history),
            new SentimentClient(sentiment),
            ledger,
            new PipelineStageLogger());
    }

    private MomentScoringService offline(InsufficientHistoryPolicy policy) {
        WebClient unreachable = StubWebClients.failing(new IOException("collaborator must not be called"));
        return service(policy, unreachable, unreachable);
    }

    private static ScoreRequest supplied(String momentId) {
        return new ScoreRequest(ScoringFixtures.homeRun(momentId), ScoringFixtures.histories(), List.of(), null);
    }

    @Nested
    @DisplayName("single moment")
    class Single {

        @Test
        @DisplayName("scores every participant from supplied history and publishes under the run id")
        void scoresSupplied() {
            MomentScoringService service = offline(InsufficientHistoryPolicy.FAIL);

            StepVerifier.create(RunContextUtil.withRunId(service.score(supplied("m-001")), "run-1"))
                .assertNext(outcome -> {
                    assertEquals("m-001", outcome.momentId());
                    assertEquals(List.of(PlayerRole.BATTER, PlayerRole.PITCHER, PlayerRole.FIELDER),
                        outcome.results().stream().map(MssResult::role).toList());
                    assertTrue(outcome.results().stream().allMatch(r -> "weights-v1".equals(r.weightVersion())));
                    assertTrue(outcome.results().get(0).score() > 0);
                    assertTrue(outcome.results().get(1).score() < 0);
                })
                .verifyComplete();

            assertEquals(3, ledger.results.get("run-1").size());
        }

        @Test
        @DisplayName("reads history and sentiment from the collaborators when not supplied")
        void fetchesMissingInputs() {
            WebClient history = StubWebClients.routed(request -> {
                String[] path = request.url().getPath().split("/");
                String id = path[path.length - 2];
                return StubWebClients.response(HttpStatus.OK, """
                    {"playerId":"%s","careerPlateAppearances":3000,"careerInningsPitched":900.0,
                     "careerAverage":0.3,"recentPerformance":[0.3,0.3,0.3,0.3,0.3,0.3]}
                    """.formatted(id));
            });
            WebClient sentiment = StubWebClients.json(HttpStatus.OK, "[]");
            MomentScoringService service = service(InsufficientHistoryPolicy.FAIL, history, sentiment);

            StepVerifier.create(service.score(new ScoreRequest(ScoringFixtures.homeRun("m-001"), null, null, null)))
                .assertNext(outcome -> assertEquals(3, outcome.results().size()))
                .verifyComplete();
        }

        @Test
        @DisplayName("a failing history store is a typed error, not an empty result")
        void collaboratorFailure() {
            MomentScoringService service = service(InsufficientHistoryPolicy.FAIL,
                StubWebClients.json(HttpStatus.INTERNAL_SERVER_ERROR, "{}"),
                StubWebClients.json(HttpStatus.OK, "[]"));

            StepVerifier.create(service.score(new ScoreRequest(ScoringFixtures.homeRun("m-001"), null, null, null)))
                .expectError(CollaboratorException.class)
                .verify();
            assertTrue(ledger.results.isEmpty());
        }

        @Test
        @DisplayName("insufficient history under FAIL rejects the moment with nothing published")
        void insufficientHistoryFails() {
            Map<String, PlayerHistory> histories = new HashMap<>(ScoringFixtures.histories());
            histories.put("fielder-1", new PlayerHistory("fielder-1", 10, 0.0, 0.2, List.of(0.2)));
            MomentScoringService service = offline(InsufficientHistoryPolicy.FAIL);

            StepVerifier.create(service.score(
                    new ScoreRequest(ScoringFixtures.homeRun("m-001"), histories, List.of(), null)))
                .expectErrorSatisfies(e ->
                    assertEquals("fielder-1", assertInstanceOf(InsufficientHistoryException.class, e).getPlayerId()))
                .verify();
            assertTrue(ledger.results.isEmpty());
        }

        @Test
        @DisplayName("malformed input is rejected before any collaborator is called")
        void malformed() {
            MomentScoringService service = offline(InsufficientHistoryPolicy.FAIL);

            StepVerifier.create(service.score(
                    new ScoreRequest(ScoringFixtures.event("m-001", null), null, null, null)))
                .expectError(MalformedMomentException.class)
                .verify();
        }

        @Test
        @DisplayName("an unknown weight version is a typed error")
        void unknownWeights() {
            MomentScoringService service = offline(InsufficientHistoryPolicy.FAIL);

            StepVerifier.create(service.score(new ScoreRequest(ScoringFixtures.homeRun("m-001"),
                    ScoringFixtures.histories(), List.of(), "weights-v7")))
                .expectError(UnknownVersionException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("batch")
    class Batch {

        @Test
        @DisplayName("a failing moment becomes an error entry and the rest are still scored, sorted by id")
        void isolatesFailures() {
            MomentScoringService service = offline(InsufficientHistoryPolicy.FAIL);
            Map<String, PlayerHistory> thin = new HashMap<>(ScoringFixtures.histories());
            thin.put("batter-1", PlayerHistory.empty("batter-1"));
            BatchScoreRequest request = new BatchScoreRequest(List.of(
                supplied("m-003"),
                new ScoreRequest(ScoringFixtures.event("m-002", " "), null, null, null),
                supplied("m-001"),
                new ScoreRequest(ScoringFixtures.homeRun("m-004"), thin, List.of(), null)), null);

            StepVerifier.create(RunContextUtil.withRunId(service.scoreBatch(request), "run-7"))
                .assertNext(response -> {
                    assertEquals("run-7", response.runId());
                    assertEquals("weights-v1", response.weightVersion());
                    assertEquals(2, response.scored());
                    assertEquals(2, response.failed());
                    assertEquals(List.of("m-001", "m-002", "m-003", "m-004"),
                        response.entries().stream().map(MomentScoreEntry::momentId).toList());
                    assertEquals(ErrorCode.MALFORMED_MOMENT, response.entries().get(1).error().code());
                    assertFalse(response.entries().get(1).error().violations().isEmpty());
                    assertEquals(ErrorCode.INSUFFICIENT_HISTORY, response.entries().get(3).error().code());
                })
                .verifyComplete();

            assertEquals(6, ledger.results.get("run-7").size());
        }

        @Test
        @DisplayName("the same batch scored twice yields identical results")
        void deterministic() {
            MomentScoringService service = offline(InsufficientHistoryPolicy.FAIL);
            BatchScoreRequest request = new BatchScoreRequest(
                List.of(supplied("m-002"), supplied("m-001")), "weights-v1");

            List<MomentScoreEntry> first  = service.scoreBatch(request).block().entries();
            List<MomentScoreEntry> second = service.scoreBatch(request).block().entries();

            assertEquals(first, second);
        }

        @Test
        @DisplayName("an unknown batch weight version fails the whole request")
        void unknownWeights() {
            MomentScoringService service = offline(InsufficientHistoryPolicy.FAIL);

            StepVerifier.create(service.scoreBatch(new BatchScoreRequest(List.of(supplied("m-001")), "nope")))
                .expectError(UnknownVersionException.class)
                .verify();
        }
    }
}
