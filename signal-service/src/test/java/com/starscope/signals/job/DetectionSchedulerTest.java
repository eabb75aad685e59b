package com.starscope.signals.job;

import com.starscope.common.model.DetectionSummary;
import com.starscope.signals.service.DetectionService;
import com.starscope.signals.service.SignalCalculationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DetectionSchedulerTest {

    private static final DetectionSummary SUMMARY = DetectionSummary.of(3, List.of());

    private SignalCalculationService calculationService;
    private DetectionService detectionService;
    private DetectionScheduler scheduler;

    @BeforeEach
    void setUp() {
        calculationService = mock(SignalCalculationService.class);
        detectionService   = mock(DetectionService.class);
        when(detectionService.runDetection()).thenReturn(Mono.just(SUMMARY));
        scheduler = new DetectionScheduler(calculationService, detectionService,
                                           Duration.ofHours(1), Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("recalculates, then detects")
    void runsCalculationThenDetection() {
        when(calculationService.calculateAll()).thenReturn(Mono.just(3));

        StepVerifier.create(scheduler.triggerNow())
            .expectNext(SUMMARY)
            .verifyComplete();

        verify(calculationService).calculateAll();
        verify(detectionService).runDetection();
    }

    @Test
    @DisplayName("a trigger while a cycle is in flight is skipped")
    void noReentry() {
        Sinks.One<Integer> calculation = Sinks.one();
        when(calculationService.calculateAll()).thenReturn(calculation.asMono());

        StepVerifier.create(scheduler.triggerNow())
            .then(() -> StepVerifier.create(scheduler.triggerNow()).verifyComplete())
            .then(() -> calculation.tryEmitValue(3))
            .expectNext(SUMMARY)
            .verifyComplete();

        verify(calculationService, times(1)).calculateAll();
        verify(detectionService, times(1)).runDetection();
    }

    @Test
    @DisplayName("a failed cycle releases the in-flight flag")
    void failureReleasesFlag() {
        when(calculationService.calculateAll())
            .thenReturn(Mono.error(new IllegalStateException("db down")))
            .thenReturn(Mono.just(1));

        StepVerifier.create(scheduler.triggerNow())
            .expectErrorMessage("db down")
            .verify();
        verify(detectionService, never()).runDetection();

        StepVerifier.create(scheduler.triggerNow())
            .expectNext(SUMMARY)
            .verifyComplete();
    }
}
