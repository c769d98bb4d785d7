package com.momentumshift.ledger.repository;

import com.momentumshift.ledger.model.WeightVersionEntry;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface WeightVersionEntryRepository extends ReactiveCrudRepository<WeightVersionEntry, Long> {

    Mono<Boolean> existsByVersion(String version);

    Mono<WeightVersionEntry> findByVersion(String version);

    Flux<WeightVersionEntry> findAllByOrderByCreatedAtAsc();
}
