package com.starscope.signals.repository;

import com.starscope.signals.model.EarlySignal;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface EarlySignalRepository extends ReactiveCrudRepository<EarlySignal, Long> {

    /**
     * Unacknowledged rows whose expiry lies after {@code now}. Feeds the
     * deduplication guard and the active listings.
     */
    @Query("""
        SELECT * FROM early_signals
        WHERE acknowledged = false
          AND expires_at > :now
        ORDER BY detected_at DESC
        """)
    Flux<EarlySignal> findActive(LocalDateTime now);

    @Query("""
        SELECT * FROM early_signals
        WHERE repo_id = :repoId
          AND acknowledged = false
          AND expires_at > :now
        ORDER BY detected_at DESC
        """)
    Flux<EarlySignal> findActiveByRepoId(long repoId, LocalDateTime now);

    Flux<EarlySignal> findByRepoIdOrderByDetectedAtDesc(long repoId);

    @Modifying
    @Query("""
        UPDATE early_signals
        SET acknowledged = true, acknowledged_at = :now
        WHERE acknowledged = false
        """)
    Mono<Integer> acknowledgeAll(LocalDateTime now);

    @Modifying
    @Query("""
        UPDATE early_signals
        SET acknowledged = true, acknowledged_at = :now
        WHERE acknowledged = false
          AND signal_type = :signalType
        """)
    Mono<Integer> acknowledgeAllOfType(String signalType, LocalDateTime now);
}
