package com.starscope.signals.service;

import com.starscope.common.model.SignalType;
import com.starscope.common.model.SnapshotAnchors;
import com.starscope.common.model.StarSnapshot;
import com.starscope.common.signal.SignalCalculator;
import com.starscope.signals.mapper.EntityMapper;
import com.starscope.signals.repository.RepoSignalRepository;
import com.starscope.signals.repository.RepoSnapshotRepository;
import com.starscope.signals.repository.TrackedRepoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * Recomputes the five stored metrics of a repo from its snapshot history.
 *
 * <p>Anchors are the nearest snapshots on or before today, today-7, today-14 and
 * today-30 ("today" from the injected UTC {@link Clock}). All non-null metrics of
 * one repo are upserted in a single transaction, so a failed write leaves the
 * previous values in place.
 */
@Service
public class SignalCalculationService {

    private static final Logger log = LoggerFactory.getLogger(SignalCalculationService.class);

    private final RepoSnapshotRepository snapshotRepository;
    private final RepoSignalRepository signalRepository;
    private final TrackedRepoRepository trackedRepoRepository;
    private final SignalCalculator calculator;
    private final TransactionalOperator transactionalOperator;
    private final Clock clock;

    public SignalCalculationService(RepoSnapshotRepository snapshotRepository,
                                    RepoSignalRepository signalRepository,
                                    TrackedRepoRepository trackedRepoRepository,
                                    SignalCalculator calculator,
                                    TransactionalOperator transactionalOperator,
                                    Clock clock) {
        this.snapshotRepository     = snapshotRepository;
        this.signalRepository       = signalRepository;
        this.trackedRepoRepository  = trackedRepoRepository;
        this.calculator             = calculator;
        this.transactionalOperator  = transactionalOperator;
        this.clock                  = clock;
    }

    public Mono<Map<SignalType, Double>> calculateAndStore(long repoId) {
        LocalDate today = LocalDate.now(clock);
        LocalDateTime calculatedAt = LocalDateTime.now(clock);

        return Mono.zip(anchor(repoId, today),
                        anchor(repoId, today.minusDays(7)),
                        anchor(repoId, today.minusDays(14)),
                        anchor(repoId, today.minusDays(SignalCalculator.MONTH_WINDOW_DAYS)))
            .map(t -> new SnapshotAnchors(t.getT1().orElse(null), t.getT2().orElse(null),
                                          t.getT3().orElse(null), t.getT4().orElse(null)))
            .map(calculator::calculate)
            .flatMap(values -> store(repoId, values, calculatedAt))
            .doOnSuccess(values -> log.info("Signals calculated. repoId={} values={}", repoId, values))
            .doOnError(e -> log.error("Signal calculation failed. repoId={}", repoId, e));
    }

    /**
     * Recomputes every tracked repo in id order. A repo whose calculation fails
     * is logged and skipped; the returned count covers the repos that succeeded.
     */
    public Mono<Integer> calculateAll() {
        return trackedRepoRepository.findAllIds()
            .concatMap(repoId -> calculateAndStore(repoId)
                .thenReturn(1)
                .onErrorResume(e -> {
                    log.warn("Skipping repo after calculation failure. repoId={}", repoId);
                    return Mono.just(0);
                }))
            .reduce(0, Integer::sum)
            .doOnSuccess(count -> log.info("Signal recalculation complete. reposUpdated={}", count));
    }

    private Mono<Optional<StarSnapshot>> anchor(long repoId, LocalDate date) {
        return snapshotRepository.findNearest(repoId, date)
            .map(EntityMapper::toStarSnapshot)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
    }

    private Mono<Map<SignalType, Double>> store(long repoId, Map<SignalType, Double> values,
                                                LocalDateTime calculatedAt) {
        return Flux.fromIterable(values.entrySet())
            .concatMap(e -> signalRepository.upsertSignal(repoId, e.getKey().key(), e.getValue(), calculatedAt))
            .then(Mono.just(values))
            .as(transactionalOperator::transactional);
    }
}
