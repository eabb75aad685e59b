package com.starscope.common.guard;

import com.starscope.common.model.ActiveSignalKey;
import com.starscope.common.model.EarlySignalFinding;
import com.starscope.common.model.EarlySignalKind;
import com.starscope.common.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeduplicationGuardTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    private static EarlySignalFinding finding(long repoId, EarlySignalKind kind) {
        return new EarlySignalFinding(repoId, kind, Severity.LOW, "test", 15.0, 2000L, null,
            NOW, NOW.plus(Duration.ofDays(7)));
    }

    @Test
    @DisplayName("active rising_star for repo X suppresses a new rising_star for X")
    void suppressesSameKey() {
        DeduplicationGuard guard = DeduplicationGuard.of(
            List.of(new ActiveSignalKey(7L, EarlySignalKind.RISING_STAR)));

        assertFalse(guard.admits(finding(7L, EarlySignalKind.RISING_STAR)));
        assertTrue(guard.isActive(7L, EarlySignalKind.RISING_STAR));
    }

    @Test
    @DisplayName("other kinds and other repos pass")
    void admitsDifferentKeys() {
        DeduplicationGuard guard = DeduplicationGuard.of(
            List.of(new ActiveSignalKey(7L, EarlySignalKind.RISING_STAR)));

        assertTrue(guard.admits(finding(7L, EarlySignalKind.BREAKOUT)));
        assertTrue(guard.admits(finding(8L, EarlySignalKind.RISING_STAR)));
    }

    @Test
    @DisplayName("empty key set admits everything")
    void emptyAdmitsAll() {
        DeduplicationGuard guard = DeduplicationGuard.of(List.of());
        assertTrue(guard.admits(finding(1L, EarlySignalKind.SUDDEN_SPIKE)));
        assertEquals(0, guard.size());
    }
}
