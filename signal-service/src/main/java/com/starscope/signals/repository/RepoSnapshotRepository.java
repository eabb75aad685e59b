package com.starscope.signals.repository;

import com.starscope.signals.model.RepoSnapshot;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface RepoSnapshotRepository extends ReactiveCrudRepository<RepoSnapshot, Long> {

    @Query("""
        SELECT * FROM repo_snapshots
        WHERE repo_id = :repoId
        ORDER BY snapshot_date DESC
        LIMIT 1
        """)
    Mono<RepoSnapshot> findLatest(long repoId);

    /**
     * Nearest snapshot on or before {@code date}. Used to anchor the 7/14/30-day
     * windows; a repo tracked for less than the window resolves to its earliest
     * snapshot only when that one is on or before the anchor.
     */
    @Query("""
        SELECT * FROM repo_snapshots
        WHERE repo_id = :repoId
          AND snapshot_date <= :date
        ORDER BY snapshot_date DESC
        LIMIT 1
        """)
    Mono<RepoSnapshot> findNearest(long repoId, LocalDate date);

    /**
     * Most recent snapshot for every repo, one row each.
     */
    @Query("""
        SELECT s.* FROM repo_snapshots s
        INNER JOIN (
            SELECT repo_id, MAX(snapshot_date) AS max_date
            FROM repo_snapshots
            GROUP BY repo_id
        ) latest ON s.repo_id = latest.repo_id AND s.snapshot_date = latest.max_date
        ORDER BY s.repo_id
        """)
    Flux<RepoSnapshot> findLatestPerRepo();

    /**
     * Up to {@code limit} most recent snapshots per repo, newest first within
     * each repo.
     */
    @Query("""
        SELECT id, repo_id, stars, forks, watchers, open_issues, snapshot_date, fetched_at
        FROM (
            SELECT s.*,
                   ROW_NUMBER() OVER (PARTITION BY s.repo_id ORDER BY s.snapshot_date DESC) AS rn
            FROM repo_snapshots s
        ) ranked
        WHERE rn <= :limit
        ORDER BY repo_id, snapshot_date DESC
        """)
    Flux<RepoSnapshot> findRecentPerRepo(int limit);

    @Query("""
        SELECT * FROM repo_snapshots
        WHERE repo_id = :repoId
        ORDER BY snapshot_date DESC
        LIMIT :limit
        """)
    Flux<RepoSnapshot> findRecentByRepoId(long repoId, int limit);
}
