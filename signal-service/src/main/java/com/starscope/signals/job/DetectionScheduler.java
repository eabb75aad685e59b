package com.starscope.signals.job;

import com.starscope.common.model.DetectionSummary;
import com.starscope.signals.service.DetectionService;
import com.starscope.signals.service.SignalCalculationService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic signal refresh: recalculates every repo's metrics, then runs a
 * persisted detection pass.
 *
 * <p>Each cycle is a fresh {@link Mono} pipeline whose terminal {@code subscribe()}
 * schedules the next one:
 * <pre>
 *   delay(interval) → calculateAll → runDetection → log summary → repeat
 * </pre>
 *
 * <p>The loop never stops on failure; cycle errors are logged and the next cycle
 * is scheduled with the regular interval. At most one cycle runs at a time, so
 * an on-demand {@link #triggerNow()} during a scheduled cycle is skipped.
 */
@Component
@ConditionalOnProperty(name = "signals.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class DetectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(DetectionScheduler.class);

    private final SignalCalculationService calculationService;
    private final DetectionService detectionService;
    private final Duration interval;
    private final Duration initialDelay;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    private volatile boolean stopped;
    private volatile Disposable pending;

    public DetectionScheduler(SignalCalculationService calculationService,
                              DetectionService detectionService,
                              @Value("${signals.scheduler.interval:PT1H}") Duration interval,
                              @Value("${signals.scheduler.initial-delay:PT1M}") Duration initialDelay) {
        this.calculationService = calculationService;
        this.detectionService   = detectionService;
        this.interval           = interval;
        this.initialDelay       = initialDelay;
    }

    @PostConstruct
    public void start() {
        log.info("Detection scheduler started. initialDelaySeconds={} intervalSeconds={}",
                 initialDelay.toSeconds(), interval.toSeconds());
        scheduleNextCycle(initialDelay);
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable current = pending;
        if (current != null) {
            current.dispose();
        }
        log.info("Detection scheduler stopped");
    }

    /**
     * Runs one cycle now unless one is already in flight, in which case the
     * returned {@code Mono} completes empty.
     */
    public Mono<DetectionSummary> triggerNow() {
        return Mono.defer(this::runCycle);
    }

    // ── loop ──────────────────────────────────────────────────────────────────

    private void scheduleNextCycle(Duration delay) {
        if (stopped) {
            return;
        }
        pending = Mono.delay(delay)
            .then(Mono.defer(this::runCycle))
            .subscribe(
                summary -> log.info("Scheduled cycle finished. entitiesScanned={} signalsDetected={}",
                                    summary.entitiesScanned(), summary.signalsDetected()),
                err -> {
                    log.error("Scheduled cycle failed, rescheduling. nextIntervalSeconds={}",
                              interval.toSeconds(), err);
                    scheduleNextCycle(interval);
                },
                () -> scheduleNextCycle(interval));
    }

    private Mono<DetectionSummary> runCycle() {
        if (!inFlight.compareAndSet(false, true)) {
            log.warn("Detection cycle already running, skipping");
            return Mono.empty();
        }
        log.info("Detection cycle starting");
        return calculationService.calculateAll()
            .then(Mono.defer(detectionService::runDetection))
            .doFinally(signal -> inFlight.set(false));
    }
}
