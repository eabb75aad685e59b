package com.starscope.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * An external mention of a repository (e.g. a Hacker News story) as handed
 * over by the mention fetcher. {@code title} may be null.
 */
public record MentionRecord(
    @JsonProperty("repoId")    long    repoId,
    @JsonProperty("source")    String  source,
    @JsonProperty("title")     String  title,
    @JsonProperty("score")     long    score,
    @JsonProperty("fetchedAt") Instant fetchedAt
) {}
