package com.starscope.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of early signal a detector can raise. Deduplication is keyed on
 * (repo, kind), so each kind has at most one active finding per repo.
 */
public enum EarlySignalKind {

    RISING_STAR("rising_star"),
    SUDDEN_SPIKE("sudden_spike"),
    BREAKOUT("breakout"),
    VIRAL_MENTION("viral_mention");

    private final String key;

    EarlySignalKind(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /** Lookup that tolerates keys written by older versions; empty when unknown. */
    public static Optional<EarlySignalKind> find(String key) {
        return Arrays.stream(values())
            .filter(k -> k.key.equals(key))
            .findFirst();
    }
}
