package com.starscope.signals.dto;

import com.starscope.common.model.EarlySignalKind;
import com.starscope.common.model.Severity;

/**
 * Filter for early-signal listings.
 *
 * @param kind                only this kind, or {@code null} for all
 * @param severity            only this severity, or {@code null} for all
 * @param includeAcknowledged also return acknowledged rows
 * @param includeExpired      also return rows past their expiry
 * @param limit               page size, clamped to 1..200
 */
public record EarlySignalQuery(
    EarlySignalKind kind,
    Severity        severity,
    boolean         includeAcknowledged,
    boolean         includeExpired,
    int             limit
) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    public EarlySignalQuery {
        limit = Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    /** Active rows of every kind and severity, default page size. */
    public static EarlySignalQuery active() {
        return new EarlySignalQuery(null, null, false, false, DEFAULT_LIMIT);
    }
}
