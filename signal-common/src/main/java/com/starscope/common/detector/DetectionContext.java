package com.starscope.common.detector;

import com.starscope.common.model.MentionRecord;
import com.starscope.common.model.SignalType;
import com.starscope.common.model.StarSnapshot;
import com.starscope.common.ranking.PercentileIndex;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only bundle of everything a detection pass needs, loaded in bulk
 * before the pass so detectors never query storage per repository.
 *
 * <ul>
 *   <li>{@code now}             – the pass's reference time (detected/expiry stamps)</li>
 *   <li>{@code latestSnapshots} – most recent snapshot per repo</li>
 *   <li>{@code recentSnapshots} – up to 30 most recent snapshots per repo, newest first</li>
 *   <li>{@code signals}         – current stored signal values per repo</li>
 *   <li>{@code mentions}        – recent external mentions per repo</li>
 *   <li>{@code velocityIndex}   – corpus-wide velocity distribution</li>
 * </ul>
 *
 * <p>All maps are copied on construction and immutable; the context can be
 * shared across worker threads for the duration of a pass.
 */
public record DetectionContext(
    Instant now,
    Map<Long, StarSnapshot> latestSnapshots,
    Map<Long, List<StarSnapshot>> recentSnapshots,
    Map<Long, Map<SignalType, Double>> signals,
    Map<Long, List<MentionRecord>> mentions,
    PercentileIndex velocityIndex
) {

    public DetectionContext {
        latestSnapshots = Map.copyOf(latestSnapshots);
        recentSnapshots = Map.copyOf(recentSnapshots);
        signals         = Map.copyOf(signals);
        mentions        = Map.copyOf(mentions);
        if (velocityIndex == null) {
            velocityIndex = PercentileIndex.empty();
        }
    }

    public Optional<StarSnapshot> latestSnapshot(long repoId) {
        return Optional.ofNullable(latestSnapshots.get(repoId));
    }

    public List<StarSnapshot> recentSnapshots(long repoId) {
        return recentSnapshots.getOrDefault(repoId, List.of());
    }

    /** Stored value of {@code type} for the repo, or {@code null} if never calculated. */
    public Double signal(long repoId, SignalType type) {
        Map<SignalType, Double> values = signals.get(repoId);
        return values != null ? values.get(type) : null;
    }

    public List<MentionRecord> mentions(long repoId) {
        return mentions.getOrDefault(repoId, List.of());
    }
}
