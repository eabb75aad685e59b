package com.starscope.common.detector;

import com.starscope.common.model.EarlySignalFinding;
import com.starscope.common.model.EarlySignalKind;
import com.starscope.common.model.Severity;
import com.starscope.common.model.SignalType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.starscope.common.detector.ContextFixture.NOW;
import static com.starscope.common.detector.ContextFixture.context;
import static org.junit.jupiter.api.Assertions.*;

class RisingStarDetectorTest {

    private final RisingStarDetector detector = new RisingStarDetector();

    private Optional<EarlySignalFinding> detect(long stars, double velocity) {
        return detector.detect(1L, context()
            .stars(1L, stars)
            .signal(1L, SignalType.VELOCITY, velocity)
            .build());
    }

    // ── firing rule ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("firing rule")
    class FiringTests {

        @Test
        @DisplayName("2000 stars, velocity 15 (ratio 0.0075) → fires LOW on absolute velocity")
        void absoluteVelocity_low() {
            EarlySignalFinding finding = detect(2000, 15).orElseThrow();

            assertEquals(EarlySignalKind.RISING_STAR, finding.kind());
            assertEquals(Severity.LOW, finding.severity());
            assertEquals(15.0, finding.velocityValue());
            assertEquals(2000L, finding.starCount());
            assertEquals("Rising star: 2,000 stars with 15.0 stars/day velocity", finding.description());
        }

        @Test
        @DisplayName("small repo fires on ratio alone")
        void ratioOnly() {
            // 3 / 200 = 0.015 ≥ 0.01 while velocity < 10
            assertTrue(detect(200, 3).isPresent());
        }

        @Test
        @DisplayName("5000 stars or more → never rising")
        void tooBig() {
            assertTrue(detect(5000, 400).isEmpty());
        }

        @Test
        @DisplayName("slow repo → no finding")
        void tooSlow() {
            // 5 / 2000 = 0.0025
            assertTrue(detect(2000, 5).isEmpty());
        }

        @Test
        @DisplayName("zero stars uses ratio 0")
        void zeroStars() {
            assertTrue(detect(0, 3).isEmpty());
            assertTrue(detect(0, 12).isPresent());
        }

        @Test
        @DisplayName("no snapshot or no velocity → no finding")
        void missingData() {
            assertTrue(detector.detect(1L, context().stars(1L, 100).build()).isEmpty());
            assertTrue(detector.detect(1L, context().signal(1L, SignalType.VELOCITY, 50).build()).isEmpty());
        }
    }

    // ── severity ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("severity")
    class SeverityTests {

        @Test
        @DisplayName("velocity ≥ 50 → HIGH")
        void highByVelocity() {
            assertEquals(Severity.HIGH, detect(4000, 50).orElseThrow().severity());
        }

        @Test
        @DisplayName("ratio ≥ 0.05 → HIGH")
        void highByRatio() {
            assertEquals(Severity.HIGH, detect(100, 5).orElseThrow().severity());
        }

        @Test
        @DisplayName("velocity ≥ 20 → MEDIUM")
        void mediumByVelocity() {
            assertEquals(Severity.MEDIUM, detect(4000, 20).orElseThrow().severity());
        }

        @Test
        @DisplayName("ratio ≥ 0.02 → MEDIUM")
        void mediumByRatio() {
            assertEquals(Severity.MEDIUM, detect(400, 8).orElseThrow().severity());
        }
    }

    @Test
    @DisplayName("attaches percentile rank and a 7-day expiry")
    void percentileAndExpiry() {
        EarlySignalFinding finding = detector.detect(1L, context()
            .stars(1L, 2000)
            .signal(1L, SignalType.VELOCITY, 15)
            .velocities(List.of(0.0, 1.0, 2.0, 15.0))
            .build()).orElseThrow();

        assertEquals(75.0, finding.percentileRank());
        assertEquals(NOW, finding.detectedAt());
        assertEquals(NOW.plus(Duration.ofDays(7)), finding.expiresAt());
    }
}
