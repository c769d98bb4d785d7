package com.momentumshift.ledger.repository;

import com.momentumshift.ledger.model.PredictionEntry;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface PredictionEntryRepository extends ReactiveCrudRepository<PredictionEntry, Long> {

    Mono<Boolean> existsByMomentIdAndPlayerIdAndWeightVersionAndModelVersionAndStatus(
        String momentId, String playerId, String weightVersion, String modelVersion, String status);

    Flux<PredictionEntry> findByMomentIdOrderByRecordedAtAsc(String momentId);

    @Query("""
        SELECT * FROM prediction_ledger
        WHERE model_version = :modelVersion
        ORDER BY moment_id, player_id, recorded_at
        LIMIT :limit
        """)
    Flux<PredictionEntry> findByModelVersion(String modelVersion, int limit);

    /** PREDICTED rows with no EVALUATED sibling: the backlog waiting for ground truth. */
    @Query("""
        SELECT p.* FROM prediction_ledger p
        WHERE p.status = 'PREDICTED'
          AND NOT EXISTS (
              SELECT 1 FROM prediction_ledger e
              WHERE e.status = 'EVALUATED'
                AND e.moment_id = p.moment_id
                AND e.player_id = p.player_id
                AND e.weight_version = p.weight_version
                AND e.model_version = p.model_version)
        ORDER BY p.recorded_at ASC
        LIMIT :limit
        """)
    Flux<PredictionEntry> findUnevaluated(int limit);
}
