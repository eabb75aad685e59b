package com.starscope.signals.service;

import com.starscope.common.model.EarlySignalKind;
import com.starscope.common.model.Severity;
import com.starscope.signals.dto.EarlySignalQuery;
import com.starscope.signals.dto.EarlySignalSummaryDTO;
import com.starscope.signals.exception.EarlySignalNotFoundException;
import com.starscope.signals.exception.RepoNotFoundException;
import com.starscope.signals.model.EarlySignal;
import com.starscope.signals.repository.EarlySignalRepository;
import com.starscope.signals.repository.TrackedRepoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Read and lifecycle operations on persisted early signals: listing, summary,
 * acknowledgement and deletion. Acknowledgement is one-way.
 */
@Service
public class EarlySignalService {

    private static final Logger log = LoggerFactory.getLogger(EarlySignalService.class);

    /** Severity high → low, then newest first. Unrecognised severities sort last. */
    private static final Comparator<EarlySignal> LISTING_ORDER =
        Comparator.comparingInt(EarlySignalService::severityRank).reversed()
                  .thenComparing(EarlySignal::getDetectedAt, Comparator.reverseOrder());

    private final EarlySignalRepository repository;
    private final TrackedRepoRepository trackedRepoRepository;
    private final Clock clock;

    public EarlySignalService(EarlySignalRepository repository,
                              TrackedRepoRepository trackedRepoRepository,
                              Clock clock) {
        this.repository            = repository;
        this.trackedRepoRepository = trackedRepoRepository;
        this.clock                 = clock;
    }

    public Flux<EarlySignal> list(EarlySignalQuery query) {
        LocalDateTime now = LocalDateTime.now(clock);
        Flux<EarlySignal> source = query.includeAcknowledged() || query.includeExpired()
            ? repository.findAll()
            : repository.findActive(now);

        return source
            .filter(visible(query.includeAcknowledged(), query.includeExpired(), now))
            .filter(s -> query.kind() == null || query.kind().key().equals(s.getSignalType()))
            .filter(s -> query.severity() == null || query.severity().key().equals(s.getSeverity()))
            .sort(LISTING_ORDER)
            .take(query.limit());
    }

    /**
     * Newest first. Fails with {@link RepoNotFoundException} when the repo is not
     * tracked, so callers can tell an unknown repo from a quiet one.
     */
    public Flux<EarlySignal> listForRepo(long repoId, boolean includeAcknowledged, boolean includeExpired) {
        LocalDateTime now = LocalDateTime.now(clock);
        return trackedRepoRepository.existsById(repoId)
            .flatMapMany(exists -> exists
                ? repository.findByRepoIdOrderByDetectedAtDesc(repoId)
                : Flux.<EarlySignal>error(new RepoNotFoundException("EarlySignalService", repoId)))
            .filter(visible(includeAcknowledged, includeExpired, now));
    }

    public Mono<EarlySignalSummaryDTO> summary() {
        return repository.findActive(LocalDateTime.now(clock))
            .collectList()
            .map(active -> new EarlySignalSummaryDTO(
                active.size(),
                active.stream().collect(Collectors.groupingBy(
                    EarlySignal::getSignalType, TreeMap::new, Collectors.counting())),
                active.stream().collect(Collectors.groupingBy(
                    EarlySignal::getSeverity, TreeMap::new, Collectors.counting())),
                active.stream().map(EarlySignal::getRepoId).distinct().count()));
    }

    /** Any row by id, whatever its state. */
    public Mono<EarlySignal> findById(long id) {
        return repository.findById(id)
            .switchIfEmpty(Mono.error(() -> new EarlySignalNotFoundException(id)));
    }

    /**
     * Marks the signal acknowledged. Acknowledging an already acknowledged
     * signal returns it unchanged, keeping the first timestamp.
     */
    public Mono<EarlySignal> acknowledge(long id) {
        return findById(id)
            .flatMap(signal -> {
                if (signal.isAcknowledged()) {
                    return Mono.just(signal);
                }
                signal.setAcknowledged(true);
                signal.setAcknowledgedAt(LocalDateTime.now(clock));
                return repository.save(signal)
                    .doOnSuccess(s -> log.info("Early signal acknowledged. id={} repoId={} kind={}",
                                               s.getId(), s.getRepoId(), s.getSignalType()));
            });
    }

    /**
     * Acknowledges every unacknowledged signal, optionally only those of
     * {@code kind}. Returns the number of rows changed.
     */
    public Mono<Integer> acknowledgeAll(EarlySignalKind kind) {
        LocalDateTime now = LocalDateTime.now(clock);
        Mono<Integer> updated = kind == null
            ? repository.acknowledgeAll(now)
            : repository.acknowledgeAllOfType(kind.key(), now);
        return updated.doOnSuccess(count -> log.info("Early signals acknowledged. kind={} count={}",
                                                     kind != null ? kind.key() : "all", count));
    }

    public Mono<Void> delete(long id) {
        return findById(id)
            .flatMap(repository::delete)
            .doOnSuccess(v -> log.info("Early signal deleted. id={}", id));
    }

    private static Predicate<EarlySignal> visible(boolean includeAcknowledged, boolean includeExpired,
                                                  LocalDateTime now) {
        return s -> (includeAcknowledged || !s.isAcknowledged())
                 && (includeExpired || isUnexpired(s, now));
    }

    private static int severityRank(EarlySignal signal) {
        return Severity.find(signal.getSeverity()).map(Severity::ordinal).orElse(-1);
    }

    private static boolean isUnexpired(EarlySignal signal, LocalDateTime now) {
        return signal.getExpiresAt() == null || signal.getExpiresAt().isAfter(now);
    }
}
