package com.starscope.common.signal;

import com.starscope.common.model.SignalType;
import com.starscope.common.model.SnapshotAnchors;
import com.starscope.common.model.StarSnapshot;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Pure signal math over a repository's daily star snapshots.
 *
 * <p>Computes the five derived metrics stored per repository:
 * <ol>
 *   <li><strong>delta</strong>: star change between the current snapshot and an
 *       anchor N days back (7 and 30).</li>
 *   <li><strong>velocity</strong>: the 7-day delta as stars per day.</li>
 *   <li><strong>acceleration</strong>: relative change of this week's velocity
 *       against last week's.</li>
 *   <li><strong>trend</strong>: discrete direction in {-1, 0, 1}.</li>
 * </ol>
 *
 * <p>Missing history is never an error: every metric that cannot be computed is
 * {@code null}, which callers read as "no signal this cycle". The only metric
 * always present is trend, which falls back to {@code 0}.
 *
 * <p>No Spring dependencies. No I/O. Stateless and thread-safe.
 */
public final class SignalCalculator {

    /** Trailing window used for velocity. */
    public static final int VELOCITY_WINDOW_DAYS = 7;

    /** Trailing window of the long delta. */
    public static final int MONTH_WINDOW_DAYS = 30;

    private static final double DAYS_PER_WEEK = 7.0;

    private final SignalThresholds thresholds;

    public SignalCalculator() {
        this(SignalThresholds.DEFAULTS);
    }

    public SignalCalculator(SignalThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Star change between two anchor snapshots.
     *
     * @return {@code null} if either snapshot is missing; {@code 0.0} if both
     *         resolve to the same snapshot date (one point, no change measurable)
     */
    public Double delta(StarSnapshot current, StarSnapshot past) {
        if (current == null || past == null) {
            return null;
        }
        if (current.snapshotDate().equals(past.snapshotDate())) {
            return 0.0;
        }
        return (double) (current.stars() - past.stars());
    }

    /**
     * Average stars per day over {@code days}; {@code null} when delta is.
     */
    public Double velocity(Double delta, int days) {
        if (delta == null) {
            return null;
        }
        return delta / days;
    }

    /**
     * Relative week-over-week change of daily velocity.
     *
     * <p>A prior-week velocity within {@code zeroEpsilon} of zero would blow the
     * ratio up, so it collapses to {@code +1.0}, {@code -1.0} or {@code 0.0}
     * depending on the sign of this week's velocity.
     *
     * @return {@code null} if any of the three anchors is missing
     */
    public Double acceleration(StarSnapshot current, StarSnapshot weekAgo, StarSnapshot twoWeeksAgo) {
        if (current == null || weekAgo == null || twoWeeksAgo == null) {
            return null;
        }

        double thisWeek  = (current.stars() - weekAgo.stars()) / DAYS_PER_WEEK;
        double priorWeek = (weekAgo.stars() - twoWeeksAgo.stars()) / DAYS_PER_WEEK;

        double epsilon = thresholds.zeroEpsilon();
        if (Math.abs(priorWeek) < epsilon) {
            if (thisWeek > epsilon) return 1.0;
            if (thisWeek < -epsilon) return -1.0;
            return 0.0;
        }

        return (thisWeek - priorWeek) / Math.abs(priorWeek);
    }

    /**
     * Discrete trend classifier. Evaluated top-to-bottom, first match wins:
     *
     * <pre>
     *  1  velocity &gt; 0.5 and (acceleration unknown or &gt; -0.1)
     * -1  velocity &lt; -0.5 or acceleration &lt; -0.3
     *  0  otherwise, or when velocity is unknown
     * </pre>
     */
    public int trend(Double velocity, Double acceleration) {
        if (velocity == null) {
            return 0;
        }

        if (velocity > thresholds.upwardVelocity()
                && (acceleration == null || acceleration > thresholds.upwardAccelerationFloor())) {
            return 1;
        }

        if (velocity < thresholds.downwardVelocity()
                || (acceleration != null && acceleration < thresholds.downwardAcceleration())) {
            return -1;
        }

        return 0;
    }

    /**
     * Computes every metric for one repository. Metrics that cannot be
     * computed are absent from the result.
     *
     * @return unmodifiable map in {@link SignalType} declaration order; never null
     */
    public Map<SignalType, Double> calculate(SnapshotAnchors anchors) {
        Double delta7d      = delta(anchors.current(), anchors.weekAgo());
        Double delta30d     = delta(anchors.current(), anchors.monthAgo());
        Double velocity     = velocity(delta7d, VELOCITY_WINDOW_DAYS);
        Double acceleration = acceleration(anchors.current(), anchors.weekAgo(), anchors.twoWeeksAgo());
        int trend           = trend(velocity, acceleration);

        Map<SignalType, Double> values = new EnumMap<>(SignalType.class);
        putIfPresent(values, SignalType.STARS_DELTA_7D, delta7d);
        putIfPresent(values, SignalType.STARS_DELTA_30D, delta30d);
        putIfPresent(values, SignalType.VELOCITY, velocity);
        putIfPresent(values, SignalType.ACCELERATION, acceleration);
        values.put(SignalType.TREND, (double) trend);
        return Collections.unmodifiableMap(values);
    }

    private static void putIfPresent(Map<SignalType, Double> values, SignalType type, Double value) {
        if (value != null) {
            values.put(type, value);
        }
    }
}
