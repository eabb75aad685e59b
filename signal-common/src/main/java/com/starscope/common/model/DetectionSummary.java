package com.starscope.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate result of one batch detection run.
 */
public record DetectionSummary(
    @JsonProperty("entities_scanned") int                          entitiesScanned,
    @JsonProperty("signals_detected") int                          signalsDetected,
    @JsonProperty("by_kind")          Map<EarlySignalKind, Integer> byKind
) {

    public static DetectionSummary of(int entitiesScanned, List<EarlySignalFinding> persisted) {
        Map<EarlySignalKind, Integer> byKind = new EnumMap<>(EarlySignalKind.class);
        for (EarlySignalFinding finding : persisted) {
            byKind.merge(finding.kind(), 1, Integer::sum);
        }
        return new DetectionSummary(entitiesScanned, persisted.size(), Map.copyOf(byKind));
    }
}
