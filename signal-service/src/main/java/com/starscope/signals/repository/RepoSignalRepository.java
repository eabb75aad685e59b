package com.starscope.signals.repository;

import com.starscope.signals.model.RepoSignal;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface RepoSignalRepository extends ReactiveCrudRepository<RepoSignal, Long> {

    /**
     * Atomic UPSERT keyed on (repo_id, signal_type). Recalculating a metric
     * replaces its value and timestamp; it never adds a second row.
     *
     * @param repoId       tracked repo id
     * @param signalType   {@code SignalType.key()}
     * @param value        metric value (trend stored as -1.0 / 0.0 / 1.0)
     * @param calculatedAt UTC calculation time
     */
    @Modifying
    @Query("""
        INSERT INTO signals (repo_id, signal_type, value, calculated_at)
        VALUES (:repoId, :signalType, :value, :calculatedAt)
        ON CONFLICT (repo_id, signal_type) DO UPDATE SET
            value         = EXCLUDED.value,
            calculated_at = EXCLUDED.calculated_at
        """)
    Mono<Void> upsertSignal(long repoId, String signalType, double value, LocalDateTime calculatedAt);

    Flux<RepoSignal> findByRepoId(long repoId);

    @Query("""
        SELECT value FROM signals
        WHERE signal_type = 'velocity'
        ORDER BY value
        """)
    Flux<Double> findAllVelocityValues();
}
