package com.starscope.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Output of a single detector run for one repository, not yet persisted.
 *
 * <ul>
 *   <li>{@code velocityValue}  – the rate the rule fired on (stars/day, or the
 *       1-day delta for a spike); null when the rule has no rate.</li>
 *   <li>{@code starCount}      – latest known star count; null when unknown.</li>
 *   <li>{@code percentileRank} – velocity rank across all repos [0, 100];
 *       only set by the rising-star rule.</li>
 * </ul>
 */
public record EarlySignalFinding(
    @JsonProperty("repoId")         long            repoId,
    @JsonProperty("kind")           EarlySignalKind kind,
    @JsonProperty("severity")       Severity        severity,
    @JsonProperty("description")    String          description,
    @JsonProperty("velocityValue")  Double          velocityValue,
    @JsonProperty("starCount")      Long            starCount,
    @JsonProperty("percentileRank") Double          percentileRank,
    @JsonProperty("detectedAt")     Instant         detectedAt,
    @JsonProperty("expiresAt")      Instant         expiresAt
) {}
