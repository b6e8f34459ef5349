package com.alertrelay.service.diagnostics;

import com.alertrelay.core.bus.EventBus;
import com.alertrelay.core.events.AlertRaised;
import com.alertrelay.core.events.Event;
import com.alertrelay.core.events.ExpiredAlertsCleaned;
import com.alertrelay.core.events.FanOutCompleted;
import com.alertrelay.core.events.LiveAlertPublished;
import com.alertrelay.core.events.SchedulerTickCompleted;
import com.alertrelay.core.events.SchedulerTickStarted;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

public final class DiagnosticsTracker {
    private final Clock clock;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final LongAdder ticksStarted = new LongAdder();
    private final LongAdder alertsPublished = new LongAdder();
    private final LongAdder publishFailures = new LongAdder();
    private final LongAdder deliveriesAttempted = new LongAdder();
    private final LongAdder deliveriesSucceeded = new LongAdder();
    private final LongAdder deliveriesSkipped = new LongAdder();
    private final LongAdder deliveriesFailed = new LongAdder();
    private final LongAdder expiredDeactivated = new LongAdder();
    private final AtomicReference<TickStatus> lastTick = new AtomicReference<>(TickStatus.empty());
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<String, String> lastErrorByCategory = new ConcurrentHashMap<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock) {
        this.clock = clock;
        eventBus.subscribeAll(this::onAnyEvent);
        eventBus.subscribe(SchedulerTickStarted.class, this::onTickStarted);
        eventBus.subscribe(SchedulerTickCompleted.class, this::onTickCompleted);
        eventBus.subscribe(LiveAlertPublished.class, event -> alertsPublished.increment());
        eventBus.subscribe(FanOutCompleted.class, this::onFanOut);
        eventBus.subscribe(ExpiredAlertsCleaned.class, event -> expiredDeactivated.add(event.deactivated()));
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        metrics.put("ticksStarted", ticksStarted.longValue());
        metrics.put("alertsPublished", alertsPublished.longValue());
        metrics.put("publishFailures", publishFailures.longValue());
        metrics.put("deliveriesAttempted", deliveriesAttempted.longValue());
        metrics.put("deliveriesSucceeded", deliveriesSucceeded.longValue());
        metrics.put("deliveriesSkipped", deliveriesSkipped.longValue());
        metrics.put("deliveriesFailed", deliveriesFailed.longValue());
        metrics.put("expiredDeactivated", expiredDeactivated.longValue());
        metrics.put("lastTick", lastTick.get().toMap());
        metrics.put("lastErrors", new HashMap<>(lastErrorByCategory));
        return metrics;
    }

    private void onAnyEvent(Event event) {
        eventsEmittedTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty() && recentEventTimestamps.peekFirst().isBefore(threshold)) {
            recentEventTimestamps.removeFirst();
        }
    }

    private void onTickStarted(SchedulerTickStarted event) {
        ticksStarted.increment();
        lastTick.updateAndGet(status -> status.withStartedAt(event.timestamp()));
    }

    private void onTickCompleted(SchedulerTickCompleted event) {
        publishFailures.add(event.failed());
        lastTick.updateAndGet(status -> status.withCompletion(event));
    }

    private void onFanOut(FanOutCompleted event) {
        deliveriesAttempted.add(event.attempted());
        deliveriesSucceeded.add(event.delivered());
        deliveriesSkipped.add(event.skipped());
        deliveriesFailed.add(event.failed());
    }

    private void onAlertRaised(AlertRaised event) {
        if (event.category() == null || event.category().isBlank()) {
            return;
        }
        lastErrorByCategory.put(event.category(), event.message() == null ? "" : event.message());
    }

    private record TickStatus(
            Instant startedAt,
            Instant completedAt,
            Integer due,
            Integer published,
            Integer failed,
            Integer abandoned,
            Long durationMillis
    ) {
        private static TickStatus empty() {
            return new TickStatus(null, null, null, null, null, null, null);
        }

        private TickStatus withStartedAt(Instant at) {
            return new TickStatus(at, completedAt, due, published, failed, abandoned, durationMillis);
        }

        private TickStatus withCompletion(SchedulerTickCompleted event) {
            return new TickStatus(startedAt, event.timestamp(), event.dueCount(), event.published(), event.failed(),
                    event.abandoned(), event.durationMillis());
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("startedAt", startedAt == null ? null : startedAt.toString());
            map.put("completedAt", completedAt == null ? null : completedAt.toString());
            map.put("due", due);
            map.put("published", published);
            map.put("failed", failed);
            map.put("abandoned", abandoned);
            map.put("durationMillis", durationMillis);
            return map;
        }
    }
}
