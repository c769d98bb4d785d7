package com.momentumshift.ledger.repository;

import com.momentumshift.ledger.model.MssResultEntry;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface MssResultEntryRepository extends ReactiveCrudRepository<MssResultEntry, Long> {

    Mono<Boolean> existsByRunIdAndMomentIdAndPlayerIdAndWeightVersion(
        String runId, String momentId, String playerId, String weightVersion);

    Flux<MssResultEntry> findByMomentIdOrderByRecordedAtAsc(String momentId);

    Flux<MssResultEntry> findByRunIdOrderByMomentIdAscPlayerIdAsc(String runId);

    /** Results as originally issued under {@code weightVersion}, in deterministic order. */
    @Query("""
        SELECT * FROM mss_result_ledger
        WHERE weight_version = :weightVersion
        ORDER BY moment_id, player_id, recorded_at
        LIMIT :limit
        """)
    Flux<MssResultEntry> findByWeightVersion(String weightVersion, int limit);
}
