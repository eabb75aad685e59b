package com.starscope.common.model;

/**
 * Identity of an active early signal for deduplication purposes.
 */
public record ActiveSignalKey(long repoId, EarlySignalKind kind) {

    public static ActiveSignalKey of(EarlySignalFinding finding) {
        return new ActiveSignalKey(finding.repoId(), finding.kind());
    }
}
