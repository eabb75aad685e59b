package com.starscope.common.detector;

import com.starscope.common.model.EarlySignalFinding;
import com.starscope.common.model.EarlySignalKind;

import java.util.Optional;

/**
 * Strategy contract for one early-signal rule.
 *
 * <p>Implementations hold no mutable state and read only from the
 * {@link DetectionContext}. They never look at another repository's data except
 * through the corpus-wide percentile index.
 *
 * <p>Deduplication against already-active findings is not the detector's
 * concern; it is applied afterwards by the guard.
 */
public interface AnomalyDetector {

    /** The kind of finding this detector raises. */
    EarlySignalKind kind();

    /**
     * Evaluates the rule for one repository.
     *
     * @return the finding, or empty when the rule does not fire or data is insufficient
     */
    Optional<EarlySignalFinding> detect(long repoId, DetectionContext context);
}
