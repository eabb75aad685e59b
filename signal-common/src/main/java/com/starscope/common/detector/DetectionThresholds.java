package com.starscope.common.detector;

import java.time.Duration;

/**
 * Named policy values for the four detectors. Grouped per rule; {@link #DEFAULTS}
 * carries the production values and tests may build their own.
 */
public record DetectionThresholds(
    RisingStar   risingStar,
    SuddenSpike  suddenSpike,
    Breakout     breakout,
    ViralMention viralMention
) {

    /**
     * @param maxStars       repos at or above this star count are no longer "rising"
     * @param minVelocity    stars/day that alone qualifies
     * @param minRatio       velocity/stars ratio that alone qualifies
     */
    public record RisingStar(
        long     maxStars,
        double   minVelocity,
        double   minRatio,
        double   highVelocity,
        double   highRatio,
        double   mediumVelocity,
        double   mediumRatio,
        Duration ttl
    ) {}

    /**
     * @param multiplier   latest delta must exceed this multiple of the trailing average
     * @param minAbsolute  latest delta must also reach this many stars
     * @param window       number of most recent snapshots considered
     */
    public record SuddenSpike(
        double   multiplier,
        long     minAbsolute,
        long     highDelta,
        long     mediumDelta,
        int      window,
        Duration ttl
    ) {}

    /**
     * @param minVelocity      current weekly velocity (stars/day) needed to break out
     * @param priorWindowDays  days between the 30-day and 7-day anchors
     */
    public record Breakout(
        double   minVelocity,
        double   highVelocity,
        double   mediumVelocity,
        int      priorWindowDays,
        Duration ttl
    ) {}

    /**
     * @param minScore  popularity score a mention needs to count as viral
     * @param lookback  how recently the mention must have been fetched
     */
    public record ViralMention(
        long     minScore,
        long     highScore,
        long     mediumScore,
        Duration lookback,
        Duration ttl
    ) {}

    public static final DetectionThresholds DEFAULTS = new DetectionThresholds(
        new RisingStar(5000, 10, 0.01, 50, 0.05, 20, 0.02, Duration.ofDays(7)),
        new SuddenSpike(3, 100, 1000, 500, 30, Duration.ofDays(3)),
        new Breakout(2, 10, 5, 23, Duration.ofDays(7)),
        new ViralMention(100, 500, 200, Duration.ofHours(48), Duration.ofDays(3))
    );
}
