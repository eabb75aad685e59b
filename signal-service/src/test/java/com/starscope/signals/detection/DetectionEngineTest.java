package com.starscope.signals.detection;

import com.starscope.common.detector.AnomalyDetector;
import com.starscope.common.detector.BreakoutDetector;
import com.starscope.common.detector.DetectionContext;
import com.starscope.common.detector.RisingStarDetector;
import com.starscope.common.guard.DeduplicationGuard;
import com.starscope.common.model.ActiveSignalKey;
import com.starscope.common.model.EarlySignalFinding;
import com.starscope.common.model.EarlySignalKind;
import com.starscope.common.model.Severity;
import com.starscope.common.model.SignalType;
import com.starscope.common.model.StarSnapshot;
import com.starscope.common.ranking.PercentileIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DetectionEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 15);

    /** Repo 1 qualifies as a low rising star; repo 2 has no data at all. */
    private static DetectionContext context() {
        return new DetectionContext(
            NOW,
            Map.of(1L, new StarSnapshot(1L, TODAY, 2000, 40, 3)),
            Map.of(),
            Map.of(1L, Map.of(SignalType.VELOCITY, 15.0)),
            Map.of(),
            PercentileIndex.of(List.of(2.0, 15.0)));
    }

    private static AnomalyDetector throwingFor(long failingRepoId) {
        return new AnomalyDetector() {
            @Override
            public EarlySignalKind kind() {
                return EarlySignalKind.SUDDEN_SPIKE;
            }

            @Override
            public Optional<EarlySignalFinding> detect(long repoId, DetectionContext context) {
                if (repoId == failingRepoId) {
                    throw new IllegalStateException("corrupt snapshot history");
                }
                return Optional.empty();
            }
        };
    }

    @Test
    @DisplayName("a detector throwing for one repo does not stop the other detectors")
    void isolatesDetectorFailure() {
        DetectionEngine engine = new DetectionEngine(
            List.of(throwingFor(1L), new RisingStarDetector(), new BreakoutDetector()));

        List<EarlySignalFinding> findings =
            engine.detectForRepo(1L, context(), DeduplicationGuard.of(List.of()));

        assertEquals(1, findings.size());
        assertEquals(EarlySignalKind.RISING_STAR, findings.get(0).kind());
        assertEquals(Severity.LOW, findings.get(0).severity());
    }

    @Test
    @DisplayName("every repo in the pass is scanned; repos without data yield nothing")
    void scansAllRepos() {
        DetectionEngine engine = new DetectionEngine(List.of(throwingFor(2L), new RisingStarDetector()));
        DetectionPass pass = new DetectionPass(List.of(1L, 2L), context(), DeduplicationGuard.of(List.of()));

        List<EarlySignalFinding> findings = engine.detect(pass);

        assertEquals(1, findings.size());
        assertEquals(1L, findings.get(0).repoId());
        assertEquals(50.0, findings.get(0).percentileRank());
    }

    @Test
    @DisplayName("a finding whose (repo, kind) is already active is suppressed")
    void suppressesActiveDuplicate() {
        DetectionEngine engine = new DetectionEngine(List.of(new RisingStarDetector()));
        DeduplicationGuard guard = DeduplicationGuard.of(
            List.of(new ActiveSignalKey(1L, EarlySignalKind.RISING_STAR)));

        assertTrue(engine.detect(new DetectionPass(List.of(1L), context(), guard)).isEmpty());
    }
}
