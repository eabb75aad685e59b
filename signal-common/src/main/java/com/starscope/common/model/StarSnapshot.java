package com.starscope.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One daily observation of a tracked repository. At most one exists per
 * ({@code repoId}, {@code snapshotDate}); never mutated once recorded.
 *
 * No logic: pure model.
 */
public record StarSnapshot(
    @JsonProperty("repoId")       long      repoId,
    @JsonProperty("snapshotDate") LocalDate snapshotDate,
    @JsonProperty("stars")        long      stars,
    @JsonProperty("forks")        long      forks,
    @JsonProperty("openIssues")   long      openIssues
) {}
