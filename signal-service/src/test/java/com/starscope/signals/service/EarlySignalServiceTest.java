package com.starscope.signals.service;

import com.starscope.common.model.EarlySignalKind;
import com.starscope.common.model.Severity;
import com.starscope.signals.dto.EarlySignalQuery;
import com.starscope.signals.exception.EarlySignalNotFoundException;
import com.starscope.signals.exception.RepoNotFoundException;
import com.starscope.signals.model.EarlySignal;
import com.starscope.signals.repository.EarlySignalRepository;
import com.starscope.signals.repository.TrackedRepoRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EarlySignalServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-15T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 15, 12, 0);

    private EarlySignalRepository repository;
    private TrackedRepoRepository trackedRepoRepository;
    private EarlySignalService service;

    private EarlySignal risingHigh;
    private EarlySignal spikeLow;
    private EarlySignal breakoutAcked;
    private EarlySignal viralExpired;

    @BeforeEach
    void setUp() {
        repository = mock(EarlySignalRepository.class);
        trackedRepoRepository = mock(TrackedRepoRepository.class);
        when(trackedRepoRepository.existsById(1L)).thenReturn(Mono.just(true));
        service = new EarlySignalService(repository, trackedRepoRepository, CLOCK);

        risingHigh    = row(1L, 1L, "rising_star", "high", NOW.minusHours(2), NOW.plusDays(6));
        spikeLow      = row(2L, 2L, "sudden_spike", "low", NOW.minusHours(1), NOW.plusDays(2));
        breakoutAcked = row(3L, 1L, "breakout", "medium", NOW.minusHours(3), NOW.plusDays(5));
        breakoutAcked.setAcknowledged(true);
        breakoutAcked.setAcknowledgedAt(NOW.minusMinutes(30));
        viralExpired  = row(4L, 3L, "viral_mention", "high", NOW.minusDays(4), NOW.minusDays(1));

        when(repository.findActive(NOW)).thenReturn(Flux.just(spikeLow, risingHigh));
        when(repository.findAll()).thenReturn(Flux.just(risingHigh, spikeLow, breakoutAcked, viralExpired));
        when(repository.save(any(EarlySignal.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
    }

    private static EarlySignal row(long id, long repoId, String kind, String severity,
                                   LocalDateTime detectedAt, LocalDateTime expiresAt) {
        EarlySignal row = new EarlySignal();
        row.setId(id);
        row.setRepoId(repoId);
        row.setSignalType(kind);
        row.setSeverity(severity);
        row.setDescription(kind);
        row.setDetectedAt(detectedAt);
        row.setExpiresAt(expiresAt);
        return row;
    }

    @Nested
    @DisplayName("list")
    class ListSignals {

        @Test
        @DisplayName("active rows ordered by severity, high first")
        void activeBySeverity() {
            StepVerifier.create(service.list(EarlySignalQuery.active()))
                .expectNext(risingHigh, spikeLow)
                .verifyComplete();
        }

        @Test
        @DisplayName("includeAcknowledged adds acknowledged rows but still hides expired ones")
        void includeAcknowledged() {
            EarlySignalQuery query = new EarlySignalQuery(null, null, true, false, 50);

            StepVerifier.create(service.list(query))
                .expectNext(risingHigh, breakoutAcked, spikeLow)
                .verifyComplete();
        }

        @Test
        @DisplayName("kind and severity filters narrow the result")
        void filters() {
            EarlySignalQuery query = new EarlySignalQuery(EarlySignalKind.VIRAL_MENTION, Severity.HIGH,
                                                          true, true, 50);

            StepVerifier.create(service.list(query))
                .expectNext(viralExpired)
                .verifyComplete();
        }

        @Test
        @DisplayName("limit is clamped to 1..200")
        void limitClamped() {
            assertEquals(1, new EarlySignalQuery(null, null, false, false, 0).limit());
            assertEquals(200, new EarlySignalQuery(null, null, false, false, 5000).limit());

            StepVerifier.create(service.list(new EarlySignalQuery(null, null, false, false, 1)))
                .expectNext(risingHigh)
                .verifyComplete();
        }

        @Test
        @DisplayName("listForRepo hides acknowledged rows unless asked")
        void listForRepo() {
            when(repository.findByRepoIdOrderByDetectedAtDesc(1L)).thenReturn(Flux.just(risingHigh, breakoutAcked));

            StepVerifier.create(service.listForRepo(1L, false, false))
                .expectNext(risingHigh)
                .verifyComplete();
            StepVerifier.create(service.listForRepo(1L, true, false))
                .expectNext(risingHigh, breakoutAcked)
                .verifyComplete();
        }

        @Test
        @DisplayName("listForRepo on an untracked repo → RepoNotFoundException")
        void listForUnknownRepo() {
            when(trackedRepoRepository.existsById(404L)).thenReturn(Mono.just(false));

            StepVerifier.create(service.listForRepo(404L, false, false))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(RepoNotFoundException.class, e);
                    assertEquals("[EarlySignalService] Tracked repo not found. repoId=404", e.getMessage());
                })
                .verify();
            verify(repository, never()).findByRepoIdOrderByDetectedAtDesc(404L);
        }

        @Test
        @DisplayName("a row with an unrecognised severity sorts last instead of failing the listing")
        void unknownSeveritySortsLast() {
            EarlySignal legacy = row(5L, 4L, "rising_star", "critical", NOW.minusMinutes(5), NOW.plusDays(1));
            when(repository.findActive(NOW)).thenReturn(Flux.just(legacy, spikeLow, risingHigh));

            StepVerifier.create(service.list(EarlySignalQuery.active()))
                .expectNext(risingHigh, spikeLow, legacy)
                .verifyComplete();
        }
    }

    @Test
    @DisplayName("summary counts active rows only")
    void summary() {
        StepVerifier.create(service.summary())
            .assertNext(summary -> {
                assertEquals(2, summary.totalActive());
                assertEquals(Map.of("rising_star", 1L, "sudden_spike", 1L), summary.byKind());
                assertEquals(Map.of("high", 1L, "low", 1L), summary.bySeverity());
                assertEquals(2, summary.reposWithSignals());
            })
            .verifyComplete();
    }

    @Nested
    @DisplayName("acknowledge")
    class Acknowledge {

        @Test
        @DisplayName("stamps the acknowledgement; the row is still readable by id")
        void acknowledges() {
            when(repository.findById(2L)).thenReturn(Mono.just(spikeLow));

            StepVerifier.create(service.acknowledge(2L))
                .assertNext(s -> {
                    assertTrue(s.isAcknowledged());
                    assertEquals(NOW, s.getAcknowledgedAt());
                })
                .verifyComplete();

            StepVerifier.create(service.findById(2L))
                .assertNext(s -> assertTrue(s.isAcknowledged()))
                .verifyComplete();
        }

        @Test
        @DisplayName("acknowledging twice keeps the first timestamp")
        void secondAcknowledgeIsNoOp() {
            when(repository.findById(3L)).thenReturn(Mono.just(breakoutAcked));

            StepVerifier.create(service.acknowledge(3L))
                .assertNext(s -> assertEquals(NOW.minusMinutes(30), s.getAcknowledgedAt()))
                .verifyComplete();

            verify(repository, never()).save(any(EarlySignal.class));
        }

        @Test
        @DisplayName("unknown id → EarlySignalNotFoundException")
        void unknownId() {
            when(repository.findById(77L)).thenReturn(Mono.empty());

            StepVerifier.create(service.acknowledge(77L))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(EarlySignalNotFoundException.class, e);
                    assertEquals("[EarlySignalService] Early signal not found. id=77", e.getMessage());
                })
                .verify();
        }

        @Test
        @DisplayName("acknowledgeAll with and without a kind")
        void acknowledgeAll() {
            when(repository.acknowledgeAll(NOW)).thenReturn(Mono.just(3));
            when(repository.acknowledgeAllOfType("breakout", NOW)).thenReturn(Mono.just(1));

            StepVerifier.create(service.acknowledgeAll(null)).expectNext(3).verifyComplete();
            StepVerifier.create(service.acknowledgeAll(EarlySignalKind.BREAKOUT)).expectNext(1).verifyComplete();
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("removes an existing row")
        void deletes() {
            when(repository.findById(1L)).thenReturn(Mono.just(risingHigh));
            when(repository.delete(risingHigh)).thenReturn(Mono.empty());

            StepVerifier.create(service.delete(1L)).verifyComplete();

            verify(repository).delete(risingHigh);
        }

        @Test
        @DisplayName("unknown id → EarlySignalNotFoundException")
        void unknownId() {
            when(repository.findById(77L)).thenReturn(Mono.empty());

            StepVerifier.create(service.delete(77L))
                .expectError(EarlySignalNotFoundException.class)
                .verify();
        }
    }
}
