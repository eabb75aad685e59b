package com.starscope.signals.repository;

import com.starscope.signals.model.TrackedRepo;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface TrackedRepoRepository extends ReactiveCrudRepository<TrackedRepo, Long> {

    @Query("SELECT id FROM repos ORDER BY id")
    Flux<Long> findAllIds();
}
