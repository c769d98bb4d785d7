package com.momentumshift.scoring.client;

import com.momentumshift.common.exception.CollaboratorException;
import com.momentumshift.common.model.Moment;
import com.momentumshift.common.model.PlayerRole;
import com.momentumshift.common.moment.MomentRecordBuilder;
import com.momentumshift.scoring.ScoringFixtures;
import com.momentumshift.scoring.StubWebClients;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class PlayerHistoryClientTest {

    private static final String HISTORY_JSON = """
        {"playerId":"%s","careerPlateAppearances":3000,"careerInningsPitched":900.0,
         "careerAverage":0.3,"recentPerformance":[0.31,0.29,0.30]}
        """;

    @Test
    @DisplayName("a found player is decoded with its trailing performance")
    void decodesHistory() {
        PlayerHistoryClient client = new PlayerHistoryClient(
            StubWebClients.json(HttpStatus.OK, HISTORY_JSON.formatted("batter-1")));

        StepVerifier.create(client.fetch("batter-1", PlayerRole.BATTER, ScoringFixtures.OCCURRED_AT, 10, "run-1"))
            .assertNext(h -> {
                assertEquals("batter-1", h.playerId());
                assertEquals(3, h.recentPerformance().size());
                assertEquals(3000, h.careerPlateAppearances());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("404 means an unknown player and yields an empty history")
    void notFoundIsEmpty() {
        PlayerHistoryClient client = new PlayerHistoryClient(StubWebClients.json(HttpStatus.NOT_FOUND, "{}"));

        StepVerifier.create(client.fetch("rookie-9", PlayerRole.BATTER, ScoringFixtures.OCCURRED_AT, 10, "run-1"))
            .assertNext(h -> {
                assertEquals("rookie-9", h.playerId());
                assertTrue(h.recentPerformance().isEmpty());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("a server error surfaces as a typed collaborator failure")
    void serverErrorIsTyped() {
        PlayerHistoryClient client = new PlayerHistoryClient(
            StubWebClients.json(HttpStatus.SERVICE_UNAVAILABLE, "{}"));

        StepVerifier.create(client.fetch("batter-1", PlayerRole.BATTER, ScoringFixtures.OCCURRED_AT, 10, "run-1"))
            .expectErrorSatisfies(e -> {
                CollaboratorException ce = assertInstanceOf(CollaboratorException.class, e);
                assertEquals("player-history", ce.getCollaborator());
            })
            .verify();
    }

    @Test
    @DisplayName("a transport failure surfaces as a typed collaborator failure")
    void transportErrorIsTyped() {
        PlayerHistoryClient client = new PlayerHistoryClient(
            StubWebClients.failing(new IOException("connection reset")));

        StepVerifier.create(client.fetch("batter-1", PlayerRole.BATTER, ScoringFixtures.OCCURRED_AT, 10, "run-1"))
            .expectError(CollaboratorException.class)
            .verify();
    }

    @Test
    @DisplayName("every participant of a moment is fetched and keyed by player id")
    void fetchesParticipants() {
        PlayerHistoryClient client = new PlayerHistoryClient(StubWebClients.routed(request -> {
            String[] path = request.url().getPath().split("/");
            String playerId = path[path.length - 2];
            return StubWebClients.response(HttpStatus.OK, HISTORY_JSON.formatted(playerId));
        }));
        Moment moment = MomentRecordBuilder.build(ScoringFixtures.homeRun("m-001"));

        StepVerifier.create(client.fetchParticipants(moment, 10, "run-1"))
            .assertNext(map -> {
                assertEquals(3, map.size());
                assertEquals("pitcher-1", map.get("pitcher-1").playerId());
                assertEquals("fielder-1", map.get("fielder-1").playerId());
            })
            .verifyComplete();
    }
}
