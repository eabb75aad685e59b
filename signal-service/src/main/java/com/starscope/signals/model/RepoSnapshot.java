package com.starscope.signals.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Daily star/fork/issue observation written by the fetch pipeline.
 * Unique per (repo_id, snapshot_date); read-only here.
 */
@Data
@NoArgsConstructor
@Table("repo_snapshots")
public class RepoSnapshot {

    @Id
    private Long id;

    private Long repoId;

    private long stars;

    private long forks;

    private long watchers;

    private long openIssues;

    private LocalDate snapshotDate;

    private LocalDateTime fetchedAt;
}
