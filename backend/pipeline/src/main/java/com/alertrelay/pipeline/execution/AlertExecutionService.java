package com.alertrelay.pipeline.execution;

import com.alertrelay.core.events.AlertRaised;
import com.alertrelay.core.events.ExpiredAlertsCleaned;
import com.alertrelay.core.events.ScheduledAlertDeactivated;
import com.alertrelay.core.events.ScheduledAlertRescheduled;
import com.alertrelay.core.events.SchedulerTickCompleted;
import com.alertrelay.core.events.SchedulerTickStarted;
import com.alertrelay.core.model.RecurrencePattern;
import com.alertrelay.core.model.ScheduledAlert;
import com.alertrelay.core.recurrence.InvalidRecurrenceException;
import com.alertrelay.core.recurrence.RecurrenceCalculator;
import com.alertrelay.pipeline.api.PipelineContext;
import com.alertrelay.pipeline.publish.AlertPublisher;
import com.alertrelay.pipeline.repository.ScheduledAlertRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives due scheduled alerts through publish and then reschedule or deactivate.
 *
 * <p>One tick runs at a time; a tick requested while another is running returns a skipped report.
 * Failures stay with the alert that caused them. A non-recurring alert is deactivated only after its publish
 * succeeded, so a failed publish is retried by the next tick and a lost deactivation write can publish twice.
 */
public class AlertExecutionService {
    static final String REASON_COMPLETED = "completed";
    static final String REASON_RECURRENCE_ENDED = "recurrence-ended";
    static final String REASON_INVALID_RECURRENCE = "invalid-recurrence";
    static final String REASON_EXPIRED = "expired";

    private static final Logger LOGGER = Logger.getLogger(AlertExecutionService.class.getName());

    private final PipelineContext context;
    private final ScheduledAlertRepository repository;
    private final AlertPublisher publisher;
    private final RecurrenceCalculator recurrenceCalculator;
    private final Duration tickBudget;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<Instant> lastExecutionTime = new AtomicReference<>();
    private final AtomicLong executionCount = new AtomicLong();

    public AlertExecutionService(
            PipelineContext context,
            ScheduledAlertRepository repository,
            AlertPublisher publisher,
            RecurrenceCalculator recurrenceCalculator,
            Duration tickBudget
    ) {
        this.context = Objects.requireNonNull(context, "context is required");
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.publisher = Objects.requireNonNull(publisher, "publisher is required");
        this.recurrenceCalculator = Objects.requireNonNull(recurrenceCalculator, "recurrenceCalculator is required");
        this.tickBudget = Objects.requireNonNull(tickBudget, "tickBudget is required");
    }

    public ExecutionRun state() {
        return new ExecutionRun(running.get(), lastExecutionTime.get(), executionCount.get());
    }

    public TickReport runTick() {
        Instant startedAt = context.clock().instant();
        if (!running.compareAndSet(false, true)) {
            LOGGER.fine("Tick requested while a tick is running; skipping");
            return TickReport.skipped(startedAt);
        }
        try {
            lastExecutionTime.set(startedAt);
            context.eventBus().publish(new SchedulerTickStarted(startedAt, executionCount.get()));
            TickReport report = executeDue(startedAt);
            executionCount.addAndGet(report.processed());
            context.eventBus().publish(new SchedulerTickCompleted(
                    context.clock().instant(),
                    report.due(),
                    report.published(),
                    report.failed(),
                    report.abandoned(),
                    report.durationMillis()
            ));
            LOGGER.info("Tick completed: due=" + report.due() + " published=" + report.published()
                    + " failed=" + report.failed() + " rescheduled=" + report.rescheduled()
                    + " deactivated=" + report.deactivated() + " abandoned=" + report.abandoned());
            return report;
        } finally {
            running.set(false);
        }
    }

    public int cleanupExpired() {
        Instant now = context.clock().instant();
        List<ScheduledAlert> expired;
        try {
            expired = repository.expiredActiveAlerts(now);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Expired alert query failed", e);
            raise("scheduler", "Expired alert query failed: " + e.getMessage(), Map.of());
            return 0;
        }

        int deactivated = 0;
        for (ScheduledAlert alert : expired) {
            if (deactivate(alert, REASON_EXPIRED)) {
                deactivated++;
            }
        }
        context.eventBus().publish(new ExpiredAlertsCleaned(context.clock().instant(), expired.size(), deactivated));
        LOGGER.info("Expired cleanup deactivated " + deactivated + " of " + expired.size() + " alerts");
        return deactivated;
    }

    private TickReport executeDue(Instant startedAt) {
        List<ScheduledAlert> due;
        try {
            due = repository.dueAlerts(startedAt);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Due alert query failed", e);
            raise("scheduler", "Due alert query failed: " + e.getMessage(), Map.of());
            return new TickReport(startedAt, false, 0, 0, 0, 0, 0, 0, elapsedMillis(startedAt));
        }

        int published = 0;
        int failed = 0;
        int rescheduled = 0;
        int deactivated = 0;
        int abandoned = 0;
        for (int i = 0; i < due.size(); i++) {
            if (Duration.between(startedAt, context.clock().instant()).compareTo(tickBudget) > 0) {
                abandoned = due.size() - i;
                LOGGER.warning("Tick budget of " + tickBudget + " exceeded; leaving " + abandoned + " alerts for the next tick");
                break;
            }
            ScheduledAlert alert = due.get(i);
            if (!publish(alert)) {
                failed++;
                continue;
            }
            published++;
            switch (advance(alert)) {
                case RESCHEDULED -> rescheduled++;
                case DEACTIVATED -> deactivated++;
                case UNCHANGED -> {
                }
            }
        }
        return new TickReport(startedAt, false, due.size(), published, failed, rescheduled, deactivated, abandoned,
                elapsedMillis(startedAt));
    }

    private boolean publish(ScheduledAlert alert) {
        try {
            publisher.publish(alert);
            return true;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Publish failed for scheduled alert " + alert.id() + "; it stays due", e);
            raise("publisher", "Publish failed for scheduled alert " + alert.id() + ": " + e.getMessage(),
                    Map.of("scheduledAlertId", alert.id()));
            return false;
        }
    }

    private Advance advance(ScheduledAlert alert) {
        Optional<RecurrencePattern> pattern = alert.effectivePattern();
        if (pattern.isEmpty()) {
            return deactivate(alert, REASON_COMPLETED) ? Advance.DEACTIVATED : Advance.UNCHANGED;
        }

        Optional<Instant> next;
        try {
            next = recurrenceCalculator.next(alert.scheduledDate(), pattern.get());
        } catch (InvalidRecurrenceException e) {
            LOGGER.warning("Scheduled alert " + alert.id() + " has an invalid recurrence: " + e.getMessage());
            return deactivate(alert, REASON_INVALID_RECURRENCE) ? Advance.DEACTIVATED : Advance.UNCHANGED;
        }
        if (next.isEmpty()) {
            return deactivate(alert, REASON_RECURRENCE_ENDED) ? Advance.DEACTIVATED : Advance.UNCHANGED;
        }

        try {
            repository.persistNextOccurrence(alert, next.get());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not reschedule alert " + alert.id() + " to " + next.get(), e);
            raise("scheduler", "Reschedule failed for scheduled alert " + alert.id() + ": " + e.getMessage(),
                    Map.of("scheduledAlertId", alert.id()));
            return Advance.UNCHANGED;
        }
        context.eventBus().publish(new ScheduledAlertRescheduled(context.clock().instant(), alert.id(), next.get()));
        return Advance.RESCHEDULED;
    }

    private boolean deactivate(ScheduledAlert alert, String reason) {
        try {
            if (!repository.deactivate(alert.id())) {
                return false;
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not deactivate scheduled alert " + alert.id() + " (" + reason + ")", e);
            raise("scheduler", "Deactivation failed for scheduled alert " + alert.id() + ": " + e.getMessage(),
                    Map.of("scheduledAlertId", alert.id(), "reason", reason));
            return false;
        }
        context.eventBus().publish(new ScheduledAlertDeactivated(context.clock().instant(), alert.id(), reason));
        return true;
    }

    private long elapsedMillis(Instant startedAt) {
        return Duration.between(startedAt, context.clock().instant()).toMillis();
    }

    private void raise(String category, String message, Map<String, Object> details) {
        context.eventBus().publish(new AlertRaised(context.clock().instant(), category, message, details));
    }

    private enum Advance {
        RESCHEDULED,
        DEACTIVATED,
        UNCHANGED
    }
}
