package com.starscope.signals.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Counts over the currently active early signals.
 *
 * @param totalActive      active rows
 * @param byKind           active rows per kind key (e.g. {@code rising_star})
 * @param bySeverity       active rows per severity key
 * @param reposWithSignals distinct repos with at least one active row
 */
public record EarlySignalSummaryDTO(
    @JsonProperty("total_active")       long              totalActive,
    @JsonProperty("by_kind")            Map<String, Long> byKind,
    @JsonProperty("by_severity")        Map<String, Long> bySeverity,
    @JsonProperty("repos_with_signals") long              reposWithSignals
) {}
