package com.starscope.signals.mapper;

import com.starscope.common.model.ActiveSignalKey;
import com.starscope.common.model.EarlySignalFinding;
import com.starscope.common.model.EarlySignalKind;
import com.starscope.common.model.MentionRecord;
import com.starscope.common.model.SignalType;
import com.starscope.common.model.StarSnapshot;
import com.starscope.signals.model.ContextSignal;
import com.starscope.signals.model.EarlySignal;
import com.starscope.signals.model.RepoSignal;
import com.starscope.signals.model.RepoSnapshot;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conversions between R2DBC rows and the pure detection model.
 * Timestamps are stored as UTC {@link LocalDateTime}.
 */
public final class EntityMapper {

    private EntityMapper() {}

    public static StarSnapshot toStarSnapshot(RepoSnapshot row) {
        return new StarSnapshot(row.getRepoId(), row.getSnapshotDate(),
                                row.getStars(), row.getForks(), row.getOpenIssues());
    }

    public static MentionRecord toMention(ContextSignal row) {
        return new MentionRecord(row.getRepoId(), row.getSignalType(), row.getTitle(),
                                 row.getScore(), toInstant(row.getFetchedAt()));
    }

    /**
     * Dedup key of an early-signal row, or empty when its {@code signal_type} is
     * not a kind this engine raises (rows left behind by retired rules).
     */
    public static Optional<ActiveSignalKey> toKey(EarlySignal row) {
        return EarlySignalKind.find(row.getSignalType())
            .map(kind -> new ActiveSignalKey(row.getRepoId(), kind));
    }

    public static EarlySignal toEntity(EarlySignalFinding finding) {
        EarlySignal entity = new EarlySignal();
        entity.setRepoId(finding.repoId());
        entity.setSignalType(finding.kind().key());
        entity.setSeverity(finding.severity().key());
        entity.setDescription(finding.description());
        entity.setVelocityValue(finding.velocityValue());
        entity.setStarCount(finding.starCount());
        entity.setPercentileRank(finding.percentileRank());
        entity.setDetectedAt(toUtc(finding.detectedAt()));
        entity.setExpiresAt(toUtc(finding.expiresAt()));
        entity.setAcknowledged(false);
        return entity;
    }

    /**
     * Groups stored metric rows into {@code repoId → {type → value}}. Rows with a
     * signal type this engine does not compute are ignored.
     */
    public static Map<Long, Map<SignalType, Double>> toSignalMap(List<RepoSignal> rows) {
        Map<Long, Map<SignalType, Double>> byRepo = new HashMap<>();
        for (RepoSignal row : rows) {
            SignalType.find(row.getSignalType()).ifPresent(type ->
                byRepo.computeIfAbsent(row.getRepoId(), id -> new EnumMap<>(SignalType.class))
                      .put(type, row.getValue()));
        }
        byRepo.replaceAll((id, values) -> Map.copyOf(values));
        return byRepo;
    }

    public static LocalDateTime toUtc(Instant instant) {
        return instant != null ? LocalDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }

    public static Instant toInstant(LocalDateTime utc) {
        return utc != null ? utc.toInstant(ZoneOffset.UTC) : null;
    }
}
