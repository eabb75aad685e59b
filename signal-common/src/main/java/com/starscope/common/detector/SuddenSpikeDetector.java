package com.starscope.common.detector;

import com.starscope.common.model.EarlySignalFinding;
import com.starscope.common.model.EarlySignalKind;
import com.starscope.common.model.Severity;
import com.starscope.common.model.StarSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Flags a single day whose star gain dwarfs the repository's recent norm.
 *
 * <p>Daily deltas are taken between consecutive snapshots of the most recent
 * window (newest first). The latest delta is compared against the mean of the
 * remaining ones, so today's jump never inflates its own baseline; with only
 * one delta the baseline is zero.
 *
 * <pre>
 * fires:  latest &gt; 3 &times; baseline AND latest &ge; 100
 * HIGH:   latest &ge; 1000
 * MEDIUM: latest &ge; 500
 * </pre>
 */
public final class SuddenSpikeDetector implements AnomalyDetector {

    private final DetectionThresholds.SuddenSpike thresholds;

    public SuddenSpikeDetector() {
        this(DetectionThresholds.DEFAULTS.suddenSpike());
    }

    public SuddenSpikeDetector(DetectionThresholds.SuddenSpike thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public EarlySignalKind kind() {
        return EarlySignalKind.SUDDEN_SPIKE;
    }

    @Override
    public Optional<EarlySignalFinding> detect(long repoId, DetectionContext context) {
        List<StarSnapshot> recent = context.recentSnapshots(repoId);
        if (recent.size() > thresholds.window()) {
            recent = recent.subList(0, thresholds.window());
        }
        if (recent.size() < 2) {
            return Optional.empty();
        }

        long[] deltas = new long[recent.size() - 1];
        for (int i = 0; i < deltas.length; i++) {
            deltas[i] = recent.get(i).stars() - recent.get(i + 1).stars();
        }

        long latestDelta = deltas[0];
        double baseline = 0.0;
        if (deltas.length > 1) {
            long sum = 0;
            for (int i = 1; i < deltas.length; i++) {
                sum += deltas[i];
            }
            baseline = (double) sum / (deltas.length - 1);
        }

        boolean spike = latestDelta > baseline * thresholds.multiplier()
            && latestDelta >= thresholds.minAbsolute();
        if (!spike) {
            return Optional.empty();
        }

        Severity severity;
        if (latestDelta >= thresholds.highDelta()) {
            severity = Severity.HIGH;
        } else if (latestDelta >= thresholds.mediumDelta()) {
            severity = Severity.MEDIUM;
        } else {
            severity = Severity.LOW;
        }

        Instant now = context.now();
        return Optional.of(new EarlySignalFinding(
            repoId,
            kind(),
            severity,
            String.format(Locale.ROOT, "Sudden spike: +%,d stars today (vs avg %.0f/day)", latestDelta, baseline),
            (double) latestDelta,
            recent.get(0).stars(),
            null,
            now,
            now.plus(thresholds.ttl())));
    }
}
