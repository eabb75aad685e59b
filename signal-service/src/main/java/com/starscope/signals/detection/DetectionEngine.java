package com.starscope.signals.detection;

import com.starscope.common.detector.AnomalyDetector;
import com.starscope.common.detector.DetectionContext;
import com.starscope.common.guard.DeduplicationGuard;
import com.starscope.common.model.EarlySignalFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs every registered {@link AnomalyDetector} against every repo of a
 * {@link DetectionPass} and keeps the findings the deduplication guard admits.
 *
 * <p>Detector failures are isolated: an exception thrown by one detector for one
 * repo is logged and counts as "no finding". The remaining detectors and repos
 * are still evaluated. No I/O happens here.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final List<AnomalyDetector> detectors;

    public DetectionEngine(List<AnomalyDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public List<EarlySignalFinding> detect(DetectionPass pass) {
        List<EarlySignalFinding> admitted = new ArrayList<>();
        for (long repoId : pass.repoIds()) {
            admitted.addAll(detectForRepo(repoId, pass.context(), pass.guard()));
        }
        return List.copyOf(admitted);
    }

    public List<EarlySignalFinding> detectForRepo(long repoId, DetectionContext context,
                                                  DeduplicationGuard guard) {
        List<EarlySignalFinding> admitted = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            Optional<EarlySignalFinding> finding = runIsolated(detector, repoId, context);
            if (finding.isEmpty()) {
                continue;
            }
            if (guard.admits(finding.get())) {
                admitted.add(finding.get());
            } else {
                log.debug("Duplicate suppressed. repoId={} kind={}", repoId, detector.kind().key());
            }
        }
        return admitted;
    }

    private Optional<EarlySignalFinding> runIsolated(AnomalyDetector detector, long repoId,
                                                     DetectionContext context) {
        try {
            return detector.detect(repoId, context);
        } catch (RuntimeException e) {
            log.error("Detector failed, treating as no finding. repoId={} kind={}",
                      repoId, detector.kind().key(), e);
            return Optional.empty();
        }
    }
}
