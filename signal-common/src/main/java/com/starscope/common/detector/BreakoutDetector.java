package com.starscope.common.detector;

import com.starscope.common.model.EarlySignalFinding;
import com.starscope.common.model.EarlySignalKind;
import com.starscope.common.model.Severity;
import com.starscope.common.model.SignalType;
import com.starscope.common.model.StarSnapshot;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Flags a repository that was flat or shrinking and has started to grow.
 *
 * <p>Both velocities come from stored deltas rather than extra snapshots:
 * <pre>
 * current = delta_7d / 7
 * prior   = (delta_30d - delta_7d) / 23     (0 when delta_30d is 0)
 * </pre>
 * The prior estimate averages the 23 days before the current week and is an
 * approximation kept as is; changing it would change which repos fire.
 *
 * <pre>
 * fires:  prior &le; 0 AND current &ge; 2
 * HIGH:   current &ge; 10
 * MEDIUM: current &ge; 5
 * </pre>
 */
public final class BreakoutDetector implements AnomalyDetector {

    private static final double DAYS_PER_WEEK = 7.0;

    private final DetectionThresholds.Breakout thresholds;

    public BreakoutDetector() {
        this(DetectionThresholds.DEFAULTS.breakout());
    }

    public BreakoutDetector(DetectionThresholds.Breakout thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public EarlySignalKind kind() {
        return EarlySignalKind.BREAKOUT;
    }

    @Override
    public Optional<EarlySignalFinding> detect(long repoId, DetectionContext context) {
        Double delta7d  = context.signal(repoId, SignalType.STARS_DELTA_7D);
        Double delta30d = context.signal(repoId, SignalType.STARS_DELTA_30D);
        if (delta7d == null || delta30d == null) {
            return Optional.empty();
        }

        double currentVelocity = delta7d / DAYS_PER_WEEK;
        double priorVelocity = delta30d != 0.0
            ? (delta30d - delta7d) / thresholds.priorWindowDays()
            : 0.0;

        boolean breakout = priorVelocity <= 0 && currentVelocity >= thresholds.minVelocity();
        if (!breakout) {
            return Optional.empty();
        }

        Severity severity;
        if (currentVelocity >= thresholds.highVelocity()) {
            severity = Severity.HIGH;
        } else if (currentVelocity >= thresholds.mediumVelocity()) {
            severity = Severity.MEDIUM;
        } else {
            severity = Severity.LOW;
        }

        Long stars = context.latestSnapshot(repoId).map(StarSnapshot::stars).orElse(null);
        Instant now = context.now();

        return Optional.of(new EarlySignalFinding(
            repoId,
            kind(),
            severity,
            String.format(Locale.ROOT, "Breakout: velocity went from %.1f to %.1f stars/day",
                priorVelocity, currentVelocity),
            currentVelocity,
            stars,
            null,
            now,
            now.plus(thresholds.ttl())));
    }
}
