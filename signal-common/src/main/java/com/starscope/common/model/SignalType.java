package com.starscope.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Derived metric kinds stored in the {@code signals} table, one live row per
 * (repo, type). {@link #key()} is the persisted column value.
 */
public enum SignalType {

    /** Star change over the trailing 7 days. */
    STARS_DELTA_7D("stars_delta_7d"),

    /** Star change over the trailing 30 days. */
    STARS_DELTA_30D("stars_delta_30d"),

    /** Average stars gained per day over the trailing 7 days. */
    VELOCITY("velocity"),

    /** Relative week-over-week change in velocity. */
    ACCELERATION("acceleration"),

    /** Discrete direction in {-1, 0, 1}, stored as a double. */
    TREND("trend");

    private final String key;

    SignalType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public static Optional<SignalType> find(String key) {
        return Arrays.stream(values())
            .filter(t -> t.key.equals(key))
            .findFirst();
    }
}
