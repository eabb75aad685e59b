package com.starscope.signals.config;

import com.starscope.common.detector.AnomalyDetector;
import com.starscope.common.detector.BreakoutDetector;
import com.starscope.common.detector.DetectionThresholds;
import com.starscope.common.detector.RisingStarDetector;
import com.starscope.common.detector.SuddenSpikeDetector;
import com.starscope.common.detector.ViralMentionDetector;
import com.starscope.common.signal.SignalCalculator;
import com.starscope.common.signal.SignalThresholds;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
public class SignalsConfig {

    // ── trend classification ──────────────────────────────────────────────────

    @Value("${signals.trend.upward-velocity:0.5}")
    private double upwardVelocity;

    @Value("${signals.trend.upward-acceleration-floor:-0.1}")
    private double upwardAccelerationFloor;

    @Value("${signals.trend.downward-velocity:-0.5}")
    private double downwardVelocity;

    @Value("${signals.trend.downward-acceleration:-0.3}")
    private double downwardAcceleration;

    @Value("${signals.trend.zero-epsilon:0.001}")
    private double zeroEpsilon;

    // ── rising star ───────────────────────────────────────────────────────────

    @Value("${signals.detectors.rising-star.max-stars:5000}")
    private long risingMaxStars;

    @Value("${signals.detectors.rising-star.min-velocity:10}")
    private double risingMinVelocity;

    @Value("${signals.detectors.rising-star.min-ratio:0.01}")
    private double risingMinRatio;

    @Value("${signals.detectors.rising-star.high-velocity:50}")
    private double risingHighVelocity;

    @Value("${signals.detectors.rising-star.high-ratio:0.05}")
    private double risingHighRatio;

    @Value("${signals.detectors.rising-star.medium-velocity:20}")
    private double risingMediumVelocity;

    @Value("${signals.detectors.rising-star.medium-ratio:0.02}")
    private double risingMediumRatio;

    @Value("${signals.detectors.rising-star.ttl:P7D}")
    private Duration risingTtl;

    // ── sudden spike ──────────────────────────────────────────────────────────

    @Value("${signals.detectors.sudden-spike.multiplier:3}")
    private double spikeMultiplier;

    @Value("${signals.detectors.sudden-spike.min-absolute:100}")
    private long spikeMinAbsolute;

    @Value("${signals.detectors.sudden-spike.high-delta:1000}")
    private long spikeHighDelta;

    @Value("${signals.detectors.sudden-spike.medium-delta:500}")
    private long spikeMediumDelta;

    @Value("${signals.detectors.sudden-spike.window:30}")
    private int spikeWindow;

    @Value("${signals.detectors.sudden-spike.ttl:P3D}")
    private Duration spikeTtl;

    // ── breakout ──────────────────────────────────────────────────────────────

    @Value("${signals.detectors.breakout.min-velocity:2}")
    private double breakoutMinVelocity;

    @Value("${signals.detectors.breakout.high-velocity:10}")
    private double breakoutHighVelocity;

    @Value("${signals.detectors.breakout.medium-velocity:5}")
    private double breakoutMediumVelocity;

    @Value("${signals.detectors.breakout.prior-window-days:23}")
    private int breakoutPriorWindowDays;

    @Value("${signals.detectors.breakout.ttl:P7D}")
    private Duration breakoutTtl;

    // ── viral mention ─────────────────────────────────────────────────────────

    @Value("${signals.detectors.viral-mention.min-score:100}")
    private long viralMinScore;

    @Value("${signals.detectors.viral-mention.high-score:500}")
    private long viralHighScore;

    @Value("${signals.detectors.viral-mention.medium-score:200}")
    private long viralMediumScore;

    @Value("${signals.detectors.viral-mention.lookback:PT48H}")
    private Duration viralLookback;

    @Value("${signals.detectors.viral-mention.ttl:P3D}")
    private Duration viralTtl;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SignalThresholds signalThresholds() {
        return new SignalThresholds(upwardVelocity, upwardAccelerationFloor,
                                    downwardVelocity, downwardAcceleration, zeroEpsilon);
    }

    @Bean
    public SignalCalculator signalCalculator(SignalThresholds signalThresholds) {
        return new SignalCalculator(signalThresholds);
    }

    @Bean
    public DetectionThresholds detectionThresholds() {
        return new DetectionThresholds(
            new DetectionThresholds.RisingStar(risingMaxStars, risingMinVelocity, risingMinRatio,
                risingHighVelocity, risingHighRatio, risingMediumVelocity, risingMediumRatio, risingTtl),
            new DetectionThresholds.SuddenSpike(spikeMultiplier, spikeMinAbsolute,
                spikeHighDelta, spikeMediumDelta, spikeWindow, spikeTtl),
            new DetectionThresholds.Breakout(breakoutMinVelocity, breakoutHighVelocity,
                breakoutMediumVelocity, breakoutPriorWindowDays, breakoutTtl),
            new DetectionThresholds.ViralMention(viralMinScore, viralHighScore,
                viralMediumScore, viralLookback, viralTtl));
    }

    /**
     * Detectors run in list order for every repo. Adding a rule means adding it here.
     */
    @Bean
    public List<AnomalyDetector> anomalyDetectors(DetectionThresholds thresholds) {
        return List.of(
            new RisingStarDetector(thresholds.risingStar()),
            new SuddenSpikeDetector(thresholds.suddenSpike()),
            new BreakoutDetector(thresholds.breakout()),
            new ViralMentionDetector(thresholds.viralMention()));
    }
}
