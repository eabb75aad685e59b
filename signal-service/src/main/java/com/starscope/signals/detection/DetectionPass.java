package com.starscope.signals.detection;

import com.starscope.common.detector.DetectionContext;
import com.starscope.common.guard.DeduplicationGuard;

import java.util.List;

/**
 * Everything one detection pass needs, loaded up front: the repos to scan, the
 * pre-loaded context they are evaluated against, and the active-signal view
 * used to suppress duplicates.
 */
public record DetectionPass(
    List<Long>         repoIds,
    DetectionContext   context,
    DeduplicationGuard guard
) {

    public DetectionPass {
        repoIds = List.copyOf(repoIds);
    }
}
