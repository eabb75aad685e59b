package com.starscope.common.guard;

import com.starscope.common.model.ActiveSignalKey;
import com.starscope.common.model.EarlySignalFinding;
import com.starscope.common.model.EarlySignalKind;

import java.util.Collection;
import java.util.Set;

/**
 * Keeps a detection pass from re-raising a finding that is still active.
 *
 * <p>Holds the (repo, kind) keys of every early signal that was unacknowledged
 * and unexpired when the pass started. A finding whose key is in the set is
 * dropped; the existing signal is left untouched (no severity or value refresh).
 *
 * <p>The key set is a point-in-time copy. Signals acknowledged or expiring
 * while the pass runs are not observed, and two passes running at once can
 * both admit the same key, so passes must not overlap.
 *
 * <p>Immutable and thread-safe.
 */
public final class DeduplicationGuard {

    private final Set<ActiveSignalKey> activeKeys;

    private DeduplicationGuard(Set<ActiveSignalKey> activeKeys) {
        this.activeKeys = activeKeys;
    }

    /** Guard over the keys active at load time. */
    public static DeduplicationGuard of(Collection<ActiveSignalKey> activeKeys) {
        return new DeduplicationGuard(Set.copyOf(activeKeys));
    }

    public boolean isActive(long repoId, EarlySignalKind kind) {
        return activeKeys.contains(new ActiveSignalKey(repoId, kind));
    }

    /** @return true when no active signal with the finding's key exists */
    public boolean admits(EarlySignalFinding finding) {
        return !activeKeys.contains(ActiveSignalKey.of(finding));
    }

    public int size() {
        return activeKeys.size();
    }
}
