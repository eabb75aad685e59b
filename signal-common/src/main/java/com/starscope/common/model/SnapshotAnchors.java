package com.starscope.common.model;

/**
 * The snapshots a repository's signals are anchored on: the current one and
 * the nearest at-or-before 7, 14 and 30 days back. Any of them may be null
 * when the history does not reach that far.
 */
public record SnapshotAnchors(
    StarSnapshot current,
    StarSnapshot weekAgo,
    StarSnapshot twoWeeksAgo,
    StarSnapshot monthAgo
) {}
