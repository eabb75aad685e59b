package com.starscope.common.signal;

/**
 * Fixed policy values used by {@link SignalCalculator}. These are chosen, not
 * derived from data; {@link #DEFAULTS} holds the production values.
 *
 * <ul>
 *   <li>{@code upwardVelocity}          – velocity above which a repo can trend up</li>
 *   <li>{@code upwardAccelerationFloor} – acceleration must stay above this to trend up</li>
 *   <li>{@code downwardVelocity}        – velocity below which a repo trends down</li>
 *   <li>{@code downwardAcceleration}    – acceleration below which a repo trends down</li>
 *   <li>{@code zeroEpsilon}             – |velocity| under this is treated as zero</li>
 * </ul>
 */
public record SignalThresholds(
    double upwardVelocity,
    double upwardAccelerationFloor,
    double downwardVelocity,
    double downwardAcceleration,
    double zeroEpsilon
) {

    public static final SignalThresholds DEFAULTS =
        new SignalThresholds(0.5, -0.1, -0.5, -0.3, 0.001);
}
