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
 * Flags small repositories gaining stars quickly, either in absolute terms or
 * relative to their size.
 *
 * <pre>
 * fires:  stars &lt; 5000 AND (velocity &ge; 10 OR velocity/stars &ge; 0.01)
 * HIGH:   velocity &ge; 50 OR ratio &ge; 0.05
 * MEDIUM: velocity &ge; 20 OR ratio &ge; 0.02
 * LOW:    otherwise
 * </pre>
 *
 * <p>The only detector that attaches a percentile rank, taken from the
 * corpus-wide velocity index.
 */
public final class RisingStarDetector implements AnomalyDetector {

    private final DetectionThresholds.RisingStar thresholds;

    public RisingStarDetector() {
        this(DetectionThresholds.DEFAULTS.risingStar());
    }

    public RisingStarDetector(DetectionThresholds.RisingStar thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public EarlySignalKind kind() {
        return EarlySignalKind.RISING_STAR;
    }

    @Override
    public Optional<EarlySignalFinding> detect(long repoId, DetectionContext context) {
        Optional<StarSnapshot> latest = context.latestSnapshot(repoId);
        if (latest.isEmpty()) {
            return Optional.empty();
        }

        long stars = latest.get().stars();
        if (stars >= thresholds.maxStars()) {
            return Optional.empty();
        }

        Double velocity = context.signal(repoId, SignalType.VELOCITY);
        if (velocity == null) {
            return Optional.empty();
        }

        double ratio = stars > 0 ? velocity / stars : 0.0;
        boolean rising = velocity >= thresholds.minVelocity() || ratio >= thresholds.minRatio();
        if (!rising) {
            return Optional.empty();
        }

        Severity severity;
        if (velocity >= thresholds.highVelocity() || ratio >= thresholds.highRatio()) {
            severity = Severity.HIGH;
        } else if (velocity >= thresholds.mediumVelocity() || ratio >= thresholds.mediumRatio()) {
            severity = Severity.MEDIUM;
        } else {
            severity = Severity.LOW;
        }

        double percentile = context.velocityIndex().rank(velocity);
        Instant now = context.now();

        return Optional.of(new EarlySignalFinding(
            repoId,
            kind(),
            severity,
            String.format(Locale.ROOT, "Rising star: %,d stars with %.1f stars/day velocity", stars, velocity),
            velocity,
            stars,
            percentile,
            now,
            now.plus(thresholds.ttl())));
    }
}
