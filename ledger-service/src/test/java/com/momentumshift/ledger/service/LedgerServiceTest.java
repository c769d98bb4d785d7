package com.momentumshift.ledger.service;

import com.momentumshift.common.exception.UnknownVersionException;
import com.momentumshift.common.ledger.WeightVersionEvent;
import com.momentumshift.common.model.ComposerWeights;
import com.momentumshift.common.model.MssResult;
import com.momentumshift.common.model.PredictionStatus;
import com.momentumshift.ledger.LedgerFixtures;
import com.momentumshift.ledger.model.MssResultEntry;
import com.momentumshift.ledger.model.PredictionEntry;
import com.momentumshift.ledger.model.WeightVersionEntry;
import com.momentumshift.ledger.repository.MssResultEntryRepository;
import com.momentumshift.ledger.repository.PredictionEntryRepository;
import com.momentumshift.ledger.repository.WeightVersionEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LedgerServiceTest {

    private MssResultEntryRepository resultRepository;
    private PredictionEntryRepository predictionRepository;
    private WeightVersionEntryRepository weightRepository;
    private LedgerService service;

    @BeforeEach
    void setUp() {
        resultRepository     = mock(MssResultEntryRepository.class);
        predictionRepository = mock(PredictionEntryRepository.class);
        weightRepository     = mock(WeightVersionEntryRepository.class);
        service = new LedgerService(resultRepository, predictionRepository, weightRepository,
            LedgerFixtures.objectMapper(), LedgerFixtures.CLOCK);

        when(resultRepository.save(any(MssResultEntry.class)))
            .thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(predictionRepository.save(any(PredictionEntry.class)))
            .thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(weightRepository.save(any(WeightVersionEntry.class)))
            .thenAnswer(inv -> Mono.just(inv.getArgument(0)));
    }

    @Nested
    class Results {

        @Test
        void appendsNewRowsWithPayloadAndColumns() {
            when(resultRepository.existsByRunIdAndMomentIdAndPlayerIdAndWeightVersion(
                anyString(), anyString(), anyString(), anyString())).thenReturn(Mono.just(false));

            StepVerifier.create(service.appendResults("run-1", List.of(LedgerFixtures.result("m-1", "batter-1"))))
                .assertNext(r -> {
                    assertEquals(1, r.appended());
                    assertTrue(r.duplicates().isEmpty());
                    assertFalse(r.hasConflicts());
                })
                .verifyComplete();

            ArgumentCaptor<MssResultEntry> saved = ArgumentCaptor.forClass(MssResultEntry.class);
            verify(resultRepository).save(saved.capture());
            MssResultEntry row = saved.getValue();
            assertEquals("run-1", row.getRunId());
            assertEquals("BATTER", row.getRole());
            assertEquals("weights-v1", row.getWeightVersion());
            assertEquals(41.1, row.getScore(), 1e-9);
            assertEquals(LocalDateTime.of(2023, 10, 21, 12, 0), row.getRecordedAt());
            assertTrue(row.getPayload().contains("\"momentId\":\"m-1\""));
        }

        @Test
        void redeliveredResultIsCountedAsDuplicateAndNotWritten() {
            when(resultRepository.existsByRunIdAndMomentIdAndPlayerIdAndWeightVersion(
                anyString(), anyString(), anyString(), anyString())).thenReturn(Mono.just(true));

            StepVerifier.create(service.appendResults("run-1", List.of(LedgerFixtures.result("m-1", "batter-1"))))
                .assertNext(r -> {
                    assertEquals(0, r.appended());
                    assertEquals(List.of("m-1|batter-1|weights-v1"), r.duplicates());
                })
                .verifyComplete();
            verify(resultRepository, never()).save(any(MssResultEntry.class));
        }

        @Test
        void uniqueConstraintRaceIsTreatedAsDuplicate() {
            when(resultRepository.existsByRunIdAndMomentIdAndPlayerIdAndWeightVersion(
                anyString(), anyString(), anyString(), anyString())).thenReturn(Mono.just(false));
            doReturn(Mono.error(new DataIntegrityViolationException("duplicate key")))
                .when(resultRepository).save(any(MssResultEntry.class));

            StepVerifier.create(service.appendResults("run-1", List.of(LedgerFixtures.result("m-1", "batter-1"))))
                .assertNext(r -> assertEquals(1, r.duplicates().size()))
                .verifyComplete();
        }

        @Test
        void queryDecodesStoredPayload() throws Exception {
            MssResult original = LedgerFixtures.result("m-1", "batter-1");
            MssResultEntry row = new MssResultEntry();
            row.setRunId("run-1");
            row.setWeightVersion("weights-v1");
            row.setPayload(LedgerFixtures.objectMapper().writeValueAsString(original));
            when(resultRepository.findByMomentIdOrderByRecordedAtAsc("m-1")).thenReturn(Flux.just(row));

            StepVerifier.create(service.results("m-1", null, "weights-v1"))
                .expectNext(original)
                .verifyComplete();
        }

        @Test
        void queryWithoutAnyFilterIsRejected() {
            StepVerifier.create(service.results(null, null, null))
                .expectError(IllegalArgumentException.class)
                .verify();
        }

        @Test
        void weightVersionQueryUsesConfiguredLimit() {
            when(resultRepository.findByWeightVersion(eq("weights-v2"), anyInt())).thenReturn(Flux.empty());

            StepVerifier.create(service.results(null, null, "weights-v2")).verifyComplete();
            verify(resultRepository).findByWeightVersion("weights-v2", 500);
        }
    }

    @Nested
    class Predictions {

        @Test
        void predictedDuplicateIsIdempotent() {
            when(predictionRepository.existsByMomentIdAndPlayerIdAndWeightVersionAndModelVersionAndStatus(
                anyString(), anyString(), anyString(), anyString(), eq("PREDICTED"))).thenReturn(Mono.just(true));

            StepVerifier.create(service.appendPredictions("run-1", List.of(LedgerFixtures.predicted("m-1", "batter-1"))))
                .assertNext(r -> {
                    assertEquals(0, r.appended());
                    assertEquals(1, r.duplicates().size());
                    assertFalse(r.hasConflicts());
                })
                .verifyComplete();
        }

        @Test
        void secondEvaluationIsRejectedWhileOthersAreAppended() {
            when(predictionRepository.existsByMomentIdAndPlayerIdAndWeightVersionAndModelVersionAndStatus(
                eq("m-1"), anyString(), anyString(), anyString(), eq("EVALUATED"))).thenReturn(Mono.just(true));
            when(predictionRepository.existsByMomentIdAndPlayerIdAndWeightVersionAndModelVersionAndStatus(
                eq("m-2"), anyString(), anyString(), anyString(), eq("EVALUATED"))).thenReturn(Mono.just(false));

            StepVerifier.create(service.appendPredictions("run-2", List.of(
                    LedgerFixtures.evaluated("m-1", "batter-1"),
                    LedgerFixtures.evaluated("m-2", "batter-1"))))
                .assertNext(r -> {
                    assertEquals(1, r.appended());
                    assertEquals(List.of("m-1|batter-1|weights-v1|model-v1"), r.rejected());
                    assertTrue(r.hasConflicts());
                })
                .verifyComplete();

            ArgumentCaptor<PredictionEntry> saved = ArgumentCaptor.forClass(PredictionEntry.class);
            verify(predictionRepository).save(saved.capture());
            assertEquals("m-2", saved.getValue().getMomentId());
            assertEquals("EVALUATED", saved.getValue().getStatus());
            assertNotNull(saved.getValue().getMeanAbsoluteError());
        }

        @Test
        void statusFilterAppliesToMomentQuery() throws Exception {
            PredictionEntry predicted = new PredictionEntry();
            predicted.setStatus("PREDICTED");
            predicted.setModelVersion("model-v1");
            predicted.setPayload(LedgerFixtures.objectMapper()
                .writeValueAsString(LedgerFixtures.predicted("m-1", "batter-1")));
            PredictionEntry evaluated = new PredictionEntry();
            evaluated.setStatus("EVALUATED");
            evaluated.setModelVersion("model-v1");
            evaluated.setPayload(LedgerFixtures.objectMapper()
                .writeValueAsString(LedgerFixtures.evaluated("m-1", "batter-1")));
            when(predictionRepository.findByMomentIdOrderByRecordedAtAsc("m-1"))
                .thenReturn(Flux.just(predicted, evaluated));

            StepVerifier.create(service.predictions("m-1", null, PredictionStatus.EVALUATED))
                .assertNext(r -> assertEquals(PredictionStatus.EVALUATED, r.status()))
                .verifyComplete();
        }
    }

    @Nested
    class Weights {

        private final ComposerWeights weights = new ComposerWeights(
            "weights-v2", 55.0, 45.0, "weights-v1", Instant.parse("2023-10-21T11:00:00Z"));

        @Test
        void recordsNewVersion() {
            when(weightRepository.existsByVersion("weights-v2")).thenReturn(Mono.just(false));

            StepVerifier.create(service.appendWeights(new WeightVersionEvent(weights, "refit")))
                .assertNext(e -> assertEquals("weights-v2", e.weights().version()))
                .verifyComplete();

            ArgumentCaptor<WeightVersionEntry> saved = ArgumentCaptor.forClass(WeightVersionEntry.class);
            verify(weightRepository).save(saved.capture());
            assertEquals("weights-v1", saved.getValue().getParentVersion());
            assertEquals(LocalDateTime.of(2023, 10, 21, 11, 0), saved.getValue().getCreatedAt());
        }

        @Test
        void existingVersionIsAConflict() {
            when(weightRepository.existsByVersion("weights-v2")).thenReturn(Mono.just(true));

            StepVerifier.create(service.appendWeights(new WeightVersionEvent(weights, "refit")))
                .expectError(LedgerConflictException.class)
                .verify();
            verify(weightRepository, never()).save(any(WeightVersionEntry.class));
        }

        @Test
        void unknownVersionLookupFails() {
            when(weightRepository.findByVersion("weights-v9")).thenReturn(Mono.empty());

            StepVerifier.create(service.weightVersion("weights-v9"))
                .expectError(UnknownVersionException.class)
                .verify();
        }

        @Test
        void storedRowRoundTripsToEvent() {
            WeightVersionEntry row = new WeightVersionEntry();
            row.setVersion("weights-v2");
            row.setParentVersion("weights-v1");
            row.setW1(55.0);
            row.setW2(45.0);
            row.setReason("refit");
            row.setCreatedAt(LocalDateTime.of(2023, 10, 21, 11, 0));
            when(weightRepository.findAllByOrderByCreatedAtAsc()).thenReturn(Flux.just(row));

            StepVerifier.create(service.weightVersions())
                .expectNext(new WeightVersionEvent(weights, "refit"))
                .verifyComplete();
        }
    }
}
