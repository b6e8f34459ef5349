package com.alertrelay.service.runtime;

import com.alertrelay.core.bus.EventBus;
import com.alertrelay.core.events.AlertRaised;
import com.alertrelay.pipeline.execution.AlertExecutionService;
import com.alertrelay.pipeline.execution.TickReport;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final AlertExecutionService executionService;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration tickInterval;
    private final Duration cleanupInterval;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService workerExecutor = Executors.newFixedThreadPool(2);

    public SchedulerService(
            AlertExecutionService executionService,
            EventBus eventBus,
            Clock clock,
            Duration tickInterval,
            Duration cleanupInterval
    ) {
        this(executionService, eventBus, clock, tickInterval, cleanupInterval, 100);
    }

    SchedulerService(
            AlertExecutionService executionService,
            EventBus eventBus,
            Clock clock,
            Duration tickInterval,
            Duration cleanupInterval,
            long minIntervalMillis
    ) {
        this.executionService = Objects.requireNonNull(executionService, "executionService is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval is required");
        this.cleanupInterval = Objects.requireNonNull(cleanupInterval, "cleanupInterval is required");
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        long tickMillis = Math.max(minIntervalMillis, tickInterval.toMillis());
        long cleanupMillis = Math.max(minIntervalMillis, cleanupInterval.toMillis());
        timerExecutor.scheduleAtFixedRate(
                () -> workerExecutor.submit(this::runOnce),
                0,
                tickMillis,
                TimeUnit.MILLISECONDS
        );
        timerExecutor.scheduleAtFixedRate(
                () -> workerExecutor.submit(this::cleanupSafely),
                cleanupMillis,
                cleanupMillis,
                TimeUnit.MILLISECONDS
        );
        LOGGER.info("Scheduler started: tick every " + tickMillis + " ms, cleanup every " + cleanupMillis + " ms");
    }

    // Null when the tick failed; the failure is already logged and raised.
    public TickReport runOnce() {
        try {
            return executionService.runTick();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Scheduled tick failed", ex);
            raise("Scheduled tick failed: " + ex.getMessage(), "tick");
            return null;
        }
    }

    public void shutdown() {
        timerExecutor.shutdown();
        workerExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            workerExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Scheduler stopped");
    }

    private void cleanupSafely() {
        try {
            executionService.cleanupExpired();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Expired alert cleanup failed", ex);
            raise("Expired alert cleanup failed: " + ex.getMessage(), "cleanup");
        }
    }

    private void raise(String message, String job) {
        eventBus.publish(new AlertRaised(clock.instant(), "scheduler", message, Map.of("job", job)));
    }
}
