package com.starscope.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Severity grade of an early signal. Declaration order is ascending, so
 * {@code compareTo} ranks {@link #HIGH} above {@link #LOW}.
 */
public enum Severity {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String key;

    Severity(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public static Optional<Severity> find(String key) {
        return Arrays.stream(values())
            .filter(s -> s.key.equals(key))
            .findFirst();
    }
}
