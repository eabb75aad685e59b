package com.starscope.signals.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Current value of one derived metric for one repository. Exactly one row per
 * (repo_id, signal_type); written only through the atomic upsert in
 * {@code RepoSignalRepository}.
 *
 * {@code signalType} holds {@code SignalType.key()} (e.g. {@code "velocity"}).
 */
@Data
@NoArgsConstructor
@Table("signals")
public class RepoSignal {

    @Id
    private Long id;

    private Long repoId;

    private String signalType;

    private double value;

    private LocalDateTime calculatedAt;
}
