package com.starscope.signals.service;

import com.starscope.common.detector.DetectionContext;
import com.starscope.common.detector.DetectionThresholds;
import com.starscope.common.guard.DeduplicationGuard;
import com.starscope.common.model.ActiveSignalKey;
import com.starscope.common.model.DetectionSummary;
import com.starscope.common.model.EarlySignalFinding;
import com.starscope.common.model.MentionRecord;
import com.starscope.common.model.SignalType;
import com.starscope.common.model.StarSnapshot;
import com.starscope.common.ranking.PercentileIndex;
import com.starscope.signals.detection.DetectionEngine;
import com.starscope.signals.detection.DetectionPass;
import com.starscope.signals.exception.RepoNotFoundException;
import com.starscope.signals.mapper.EntityMapper;
import com.starscope.signals.model.ContextSignal;
import com.starscope.signals.model.EarlySignal;
import com.starscope.signals.repository.ContextSignalRepository;
import com.starscope.signals.repository.EarlySignalRepository;
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
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs detection passes over the tracked repos.
 *
 * <p>Every pass bulk-loads its inputs first (snapshots, stored signals, the
 * corpus-wide velocity percentile index, recent mentions and the active
 * early-signal keys), then hands one immutable {@link DetectionPass} to the
 * {@link DetectionEngine}. Nothing is queried per repo per detector.
 *
 * <p>Persistence groups admitted findings by repo; each repo's findings commit
 * in one transaction and repos are written one after another. A storage error
 * fails the returned {@code Mono}.
 */
@Service
public class DetectionService {

    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    private final TrackedRepoRepository trackedRepoRepository;
    private final RepoSnapshotRepository snapshotRepository;
    private final RepoSignalRepository signalRepository;
    private final EarlySignalRepository earlySignalRepository;
    private final ContextSignalRepository contextSignalRepository;
    private final DetectionEngine engine;
    private final DetectionThresholds thresholds;
    private final TransactionalOperator transactionalOperator;
    private final Clock clock;

    public DetectionService(TrackedRepoRepository trackedRepoRepository,
                            RepoSnapshotRepository snapshotRepository,
                            RepoSignalRepository signalRepository,
                            EarlySignalRepository earlySignalRepository,
                            ContextSignalRepository contextSignalRepository,
                            DetectionEngine engine,
                            DetectionThresholds thresholds,
                            TransactionalOperator transactionalOperator,
                            Clock clock) {
        this.trackedRepoRepository   = trackedRepoRepository;
        this.snapshotRepository      = snapshotRepository;
        this.signalRepository        = signalRepository;
        this.earlySignalRepository   = earlySignalRepository;
        this.contextSignalRepository = contextSignalRepository;
        this.engine                  = engine;
        this.thresholds              = thresholds;
        this.transactionalOperator   = transactionalOperator;
        this.clock                   = clock;
    }

    /**
     * Scans every tracked repo and returns the findings that survive
     * deduplication. Nothing is persisted.
     */
    public Mono<List<EarlySignalFinding>> detectAll() {
        return loadBatchPass(clock.instant()).map(engine::detect);
    }

    /**
     * Scans every tracked repo, persists the surviving findings and reports
     * what was written.
     */
    public Mono<DetectionSummary> runDetection() {
        return loadBatchPass(clock.instant())
            .flatMap(pass -> persist(engine.detect(pass))
                .map(persisted -> DetectionSummary.of(pass.repoIds().size(), persisted)))
            .doOnSuccess(summary -> log.info(
                "Detection complete. entitiesScanned={} signalsDetected={} byKind={}",
                summary.entitiesScanned(), summary.signalsDetected(), summary.byKind()))
            .doOnError(e -> log.error("Detection run failed", e));
    }

    /**
     * Single-repo variant of {@link #detectAll()}: inputs and active keys are
     * loaded for {@code repoId} only, the percentile index stays corpus-wide.
     * Returns findings without persisting them.
     */
    public Mono<List<EarlySignalFinding>> detectAllForRepo(long repoId) {
        Instant now = clock.instant();
        return trackedRepoRepository.existsById(repoId)
            .flatMap(exists -> exists
                ? loadRepoPass(repoId, now)
                : Mono.<DetectionPass>error(new RepoNotFoundException("DetectionService", repoId)))
            .map(pass -> engine.detectForRepo(repoId, pass.context(), pass.guard()));
    }

    // ── bulk loading ──────────────────────────────────────────────────────────

    private Mono<DetectionPass> loadBatchPass(Instant now) {
        LocalDateTime nowUtc = EntityMapper.toUtc(now);
        LocalDateTime mentionsSince = EntityMapper.toUtc(now.minus(thresholds.viralMention().lookback()));

        Mono<List<Long>> repoIds = trackedRepoRepository.findAllIds().collectList();
        Mono<Map<Long, StarSnapshot>> latest = snapshotRepository.findLatestPerRepo()
            .map(EntityMapper::toStarSnapshot)
            .collectMap(StarSnapshot::repoId);
        Mono<Map<Long, List<StarSnapshot>>> recent = groupByRepo(
            snapshotRepository.findRecentPerRepo(thresholds.suddenSpike().window())
                .map(EntityMapper::toStarSnapshot),
            StarSnapshot::repoId);
        Mono<Map<Long, Map<SignalType, Double>>> signals =
            signalRepository.findAll().collectList().map(EntityMapper::toSignalMap);
        Mono<Set<ActiveSignalKey>> activeKeys = activeKeys(earlySignalRepository.findActive(nowUtc));
        Mono<Map<Long, List<MentionRecord>>> mentions = groupByRepo(
            contextSignalRepository.findRecentMentions(ContextSignal.HACKER_NEWS, mentionsSince)
                .map(EntityMapper::toMention),
            MentionRecord::repoId);

        return Mono.zip(repoIds, latest, recent, signals, velocityIndex(), activeKeys, mentions)
            .map(t -> {
                DetectionContext context = new DetectionContext(now, t.getT2(), t.getT3(), t.getT4(),
                                                                t.getT7(), t.getT5());
                DeduplicationGuard guard = DeduplicationGuard.of(t.getT6());
                log.debug("Detection inputs loaded. repos={} activeSignals={} velocityIndexSize={}",
                          t.getT1().size(), guard.size(), t.getT5().size());
                return new DetectionPass(t.getT1(), context, guard);
            });
    }

    private Mono<DetectionPass> loadRepoPass(long repoId, Instant now) {
        LocalDateTime nowUtc = EntityMapper.toUtc(now);
        LocalDateTime mentionsSince = EntityMapper.toUtc(now.minus(thresholds.viralMention().lookback()));

        Mono<Map<Long, StarSnapshot>> latest = snapshotRepository.findLatest(repoId)
            .map(s -> Map.of(repoId, EntityMapper.toStarSnapshot(s)))
            .defaultIfEmpty(Map.of());
        Mono<Map<Long, List<StarSnapshot>>> recent = groupByRepo(
            snapshotRepository.findRecentByRepoId(repoId, thresholds.suddenSpike().window())
                .map(EntityMapper::toStarSnapshot),
            StarSnapshot::repoId);
        Mono<Map<Long, Map<SignalType, Double>>> signals =
            signalRepository.findByRepoId(repoId).collectList().map(EntityMapper::toSignalMap);
        Mono<Set<ActiveSignalKey>> activeKeys =
            activeKeys(earlySignalRepository.findActiveByRepoId(repoId, nowUtc));
        Mono<Map<Long, List<MentionRecord>>> mentions = groupByRepo(
            contextSignalRepository.findRecentMentionsByRepoId(repoId, ContextSignal.HACKER_NEWS, mentionsSince)
                .map(EntityMapper::toMention),
            MentionRecord::repoId);

        return Mono.zip(latest, recent, signals, velocityIndex(), activeKeys, mentions)
            .map(t -> new DetectionPass(
                List.of(repoId),
                new DetectionContext(now, t.getT1(), t.getT2(), t.getT3(), t.getT6(), t.getT4()),
                DeduplicationGuard.of(t.getT5())));
    }

    /**
     * Dedup keys of the active rows. A row with a kind this engine no longer
     * raises is logged and left out; it cannot collide with a new finding.
     */
    private static Mono<Set<ActiveSignalKey>> activeKeys(Flux<EarlySignal> activeRows) {
        return activeRows
            .flatMap(row -> {
                Optional<ActiveSignalKey> key = EntityMapper.toKey(row);
                if (key.isEmpty()) {
                    log.warn("Ignoring active early signal with unknown kind. id={} repoId={} signalType={}",
                             row.getId(), row.getRepoId(), row.getSignalType());
                }
                return Mono.justOrEmpty(key);
            })
            .collect(Collectors.toSet());
    }

    private Mono<PercentileIndex> velocityIndex() {
        return signalRepository.findAllVelocityValues().collectList().map(PercentileIndex::of);
    }

    /**
     * Collects a flux into {@code repoId → list}, keeping arrival order within
     * each repo (the queries deliver snapshots newest first).
     */
    private static <T> Mono<Map<Long, List<T>>> groupByRepo(Flux<T> rows,
                                                            Function<T, Long> repoId) {
        return rows.collectMultimap(repoId)
            .map(grouped -> {
                Map<Long, List<T>> result = new HashMap<>();
                for (Map.Entry<Long, Collection<T>> entry : grouped.entrySet()) {
                    result.put(entry.getKey(), List.copyOf(entry.getValue()));
                }
                return result;
            });
    }

    // ── persistence ───────────────────────────────────────────────────────────

    private Mono<List<EarlySignalFinding>> persist(List<EarlySignalFinding> findings) {
        Map<Long, List<EarlySignalFinding>> byRepo = findings.stream()
            .collect(Collectors.groupingBy(EarlySignalFinding::repoId, LinkedHashMap::new, Collectors.toList()));

        return Flux.fromIterable(byRepo.entrySet())
            .concatMap(entry -> persistRepo(entry.getKey(), entry.getValue()))
            .collectList()
            .map(batches -> {
                List<EarlySignalFinding> persisted = new ArrayList<>();
                batches.forEach(persisted::addAll);
                return List.copyOf(persisted);
            });
    }

    private Mono<List<EarlySignalFinding>> persistRepo(long repoId, List<EarlySignalFinding> findings) {
        return Flux.fromIterable(findings)
            .concatMap(finding -> earlySignalRepository.save(EntityMapper.toEntity(finding)))
            .then(Mono.just(findings))
            .as(transactionalOperator::transactional)
            .doOnSuccess(saved -> log.info("Early signals persisted. repoId={} kinds={}", repoId,
                saved.stream().map(f -> f.kind().key()).collect(Collectors.toList())))
            .doOnError(e -> log.error("Failed to persist early signals. repoId={}", repoId, e));
    }
}
