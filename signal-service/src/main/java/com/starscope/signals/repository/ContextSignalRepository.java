package com.starscope.signals.repository;

import com.starscope.signals.model.ContextSignal;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface ContextSignalRepository extends ReactiveCrudRepository<ContextSignal, Long> {

    @Query("""
        SELECT * FROM context_signals
        WHERE signal_type = :signalType
          AND fetched_at >= :since
        ORDER BY score DESC
        """)
    Flux<ContextSignal> findRecentMentions(String signalType, LocalDateTime since);

    @Query("""
        SELECT * FROM context_signals
        WHERE repo_id = :repoId
          AND signal_type = :signalType
          AND fetched_at >= :since
        ORDER BY score DESC
        """)
    Flux<ContextSignal> findRecentMentionsByRepoId(long repoId, String signalType, LocalDateTime since);
}
