package com.alertrelay.pipeline.execution;

import com.alertrelay.core.bus.EventBus;
import com.alertrelay.core.events.AlertRaised;
import com.alertrelay.core.events.ExpiredAlertsCleaned;
import com.alertrelay.core.events.LiveAlertPublished;
import com.alertrelay.core.events.ScheduledAlertDeactivated;
import com.alertrelay.core.events.ScheduledAlertRescheduled;
import com.alertrelay.core.events.SchedulerTickCompleted;
import com.alertrelay.core.events.SchedulerTickStarted;
import com.alertrelay.core.model.LiveAlert;
import com.alertrelay.core.model.RecurrenceFrequency;
import com.alertrelay.core.model.RecurrencePattern;
import com.alertrelay.core.model.ScheduledAlert;
import com.alertrelay.core.recurrence.RecurrenceCalculator;
import com.alertrelay.pipeline.api.IdentityProvider;
import com.alertrelay.pipeline.api.PipelineContext;
import com.alertrelay.pipeline.codec.LiveAlertCodec;
import com.alertrelay.pipeline.dispatch.NotificationDispatcher;
import com.alertrelay.pipeline.followers.FollowerResolver;
import com.alertrelay.pipeline.followers.StoredGroupPreferenceFilter;
import com.alertrelay.pipeline.publish.AlertPublisher;
import com.alertrelay.pipeline.repository.ScheduledAlertRepository;
import com.alertrelay.pipeline.store.CollectionPaths;
import com.alertrelay.pipeline.store.Query;
import com.alertrelay.pipeline.support.EventCapture;
import com.alertrelay.pipeline.support.FaultyDocumentStore;
import com.alertrelay.pipeline.support.Fixtures;
import com.alertrelay.pipeline.support.MutableClock;
import com.alertrelay.pipeline.support.RecordingGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertExecutionServiceTest {
    private static final Instant T0 = Instant.parse("2026-02-02T09:00:00Z");

    private final MutableClock clock = new MutableClock(T0, ZoneOffset.UTC);
    private final FaultyDocumentStore store = new FaultyDocumentStore(clock);
    private final EventBus bus = new EventBus();
    private final EventCapture capture = new EventCapture(bus);
    private final ExecutorService pool = Executors.newFixedThreadPool(2);
    private final RecordingGateway push = RecordingGateway.addressingEveryone("push");
    private final ScheduledAlertRepository repository = new ScheduledAlertRepository(store);
    private final PipelineContext context = new PipelineContext(store, bus, clock, Duration.ofSeconds(2));
    private final AlertPublisher publisher = new AlertPublisher(
            context,
            new FollowerResolver(store, new StoredGroupPreferenceFilter(store)),
            new NotificationDispatcher(List.of(push), pool, context.requestTimeout()),
            IdentityProvider.none()
    );

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    @Test
    void weeklyAlertIsPublishedAndMovedOneWeekAhead() {
        Fixtures.organization(store, "A", "B");
        repository.save(Fixtures.recurring("weekly", T0, RecurrencePattern.every(1, RecurrenceFrequency.WEEKLY)));

        TickReport report = service(Duration.ofMinutes(1)).runTick();

        assertEquals(1, report.published());
        assertEquals(1, report.rescheduled());
        ScheduledAlert stored = repository.find("weekly").orElseThrow();
        assertEquals(T0.plus(Duration.ofDays(7)), stored.scheduledDate());
        assertTrue(stored.active());
        assertEquals(1, liveAlerts().size());
        assertEquals(T0.plus(Duration.ofDays(7)), capture.byType(ScheduledAlertRescheduled.class).get(0).nextScheduledDate());
    }

    @Test
    void oneShotAlertIsDeactivatedAndNeverRepublished() {
        Fixtures.organization(store, "A");
        repository.save(Fixtures.oneShot("once", T0.minusSeconds(60)));
        AlertExecutionService service = service(Duration.ofMinutes(1));

        service.runTick();
        clock.advance(Duration.ofDays(1));
        TickReport nextDay = service.runTick();

        assertFalse(repository.find("once").orElseThrow().active());
        assertEquals(0, nextDay.due());
        assertEquals(1, liveAlerts().size());
        assertEquals(List.of("push:A"), push.sentTargets());
        ScheduledAlertDeactivated deactivated = capture.byType(ScheduledAlertDeactivated.class).get(0);
        assertEquals(AlertExecutionService.REASON_COMPLETED, deactivated.reason());
    }

    @Test
    void futureAlertIsLeftAlone() {
        Fixtures.organization(store, "A");
        repository.save(Fixtures.oneShot("future", T0.plusSeconds(1)));

        TickReport report = service(Duration.ofMinutes(1)).runTick();

        assertEquals(0, report.due());
        assertTrue(repository.find("future").orElseThrow().active());
        assertTrue(liveAlerts().isEmpty());
    }

    @Test
    void failedPublishKeepsAlertDueAndRetriesNextTick() {
        Fixtures.organization(store, "A");
        repository.save(Fixtures.oneShot("flaky", T0));
        store.failOn(FaultyDocumentStore.Operation.SET, CollectionPaths.organizationAlerts(Fixtures.ORG_ID));
        AlertExecutionService service = service(Duration.ofMinutes(1));

        TickReport failed = service.runTick();

        assertEquals(1, failed.failed());
        assertTrue(repository.find("flaky").orElseThrow().active());
        assertTrue(push.sent().isEmpty());
        assertTrue(capture.byType(AlertRaised.class).stream().anyMatch(raised -> raised.category().equals("publisher")));

        store.heal();
        clock.advance(Duration.ofMinutes(5));
        TickReport retried = service.runTick();

        assertEquals(1, retried.published());
        assertFalse(repository.find("flaky").orElseThrow().active());
        assertEquals(1, liveAlerts().size());
    }

    @Test
    void failedCountIncrementCountsAsFailedPublishAndKeepsOneShotActive() {
        Fixtures.organization(store, "A");
        repository.save(Fixtures.oneShot("counted", T0));
        store.failOn(FaultyDocumentStore.Operation.INCREMENT, CollectionPaths.ORGANIZATIONS);

        TickReport report = service(Duration.ofMinutes(1)).runTick();

        assertEquals(0, report.published());
        assertEquals(1, report.failed());
        assertTrue(repository.find("counted").orElseThrow().active());
        assertTrue(push.sent().isEmpty());
        assertEquals(1, liveAlerts().size());
        assertTrue(capture.byType(ScheduledAlertDeactivated.class).isEmpty());
    }

    @Test
    void oneFailingAlertDoesNotStopTheOthers() {
        Fixtures.organization(store, "A");
        repository.save(Fixtures.oneShot("first", T0.minusSeconds(30)));
        repository.save(Fixtures.oneShot("second", T0.minusSeconds(20)));
        store.failOn(FaultyDocumentStore.Operation.UPDATE, CollectionPaths.SCHEDULED_ALERTS);

        TickReport report = service(Duration.ofMinutes(1)).runTick();

        assertEquals(2, report.published());
        assertEquals(0, report.deactivated());
        assertEquals(2, capture.byType(AlertRaised.class).stream().filter(raised -> raised.category().equals("scheduler")).count());
        assertTrue(repository.find("first").orElseThrow().active());
    }

    @Test
    void recurrencePastEndDateDeactivates() {
        Fixtures.organization(store, "A");
        RecurrencePattern daily = RecurrencePattern.every(1, RecurrenceFrequency.DAILY).until(T0.plus(Duration.ofHours(12)));
        repository.save(Fixtures.recurring("ending", T0, daily));

        TickReport report = service(Duration.ofMinutes(1)).runTick();

        assertEquals(1, report.published());
        assertEquals(1, report.deactivated());
        assertFalse(repository.find("ending").orElseThrow().active());
        assertEquals(AlertExecutionService.REASON_RECURRENCE_ENDED,
                capture.byType(ScheduledAlertDeactivated.class).get(0).reason());
    }

    @Test
    void invalidIntervalDeactivatesAfterPublishing() {
        Fixtures.organization(store, "A");
        repository.save(Fixtures.recurring("broken", T0, RecurrencePattern.every(0, RecurrenceFrequency.WEEKLY)));

        service(Duration.ofMinutes(1)).runTick();

        assertFalse(repository.find("broken").orElseThrow().active());
        assertEquals(1, liveAlerts().size());
        assertEquals(AlertExecutionService.REASON_INVALID_RECURRENCE,
                capture.byType(ScheduledAlertDeactivated.class).get(0).reason());
    }

    @Test
    void recurringFlagWithoutPatternIsTreatedAsOneShot() {
        Fixtures.organization(store, "A");
        repository.save(Fixtures.recurring("no-pattern", T0, null));

        service(Duration.ofMinutes(1)).runTick();

        assertFalse(repository.find("no-pattern").orElseThrow().active());
    }

    @Test
    void budgetExceededLeavesRemainingAlertsForNextTick() {
        Fixtures.organization(store, "A");
        repository.save(Fixtures.oneShot("a", T0.minusSeconds(30)));
        repository.save(Fixtures.oneShot("b", T0.minusSeconds(20)));
        repository.save(Fixtures.oneShot("c", T0.minusSeconds(10)));
        bus.subscribe(LiveAlertPublished.class, ignored -> clock.advance(Duration.ofSeconds(40)));
        AlertExecutionService service = service(Duration.ofSeconds(30));

        TickReport report = service.runTick();

        assertEquals(3, report.due());
        assertEquals(1, report.published());
        assertEquals(2, report.abandoned());
        assertTrue(repository.find("b").orElseThrow().active());
        assertTrue(repository.find("c").orElseThrow().active());
        assertEquals(2, capture.byType(SchedulerTickCompleted.class).get(0).abandoned());
        assertEquals(1, service.state().executionCount());
    }

    @Test
    void overlappingTickIsSkipped() throws Exception {
        Fixtures.organization(store, "A");
        repository.save(Fixtures.oneShot("s1", T0));
        CountDownLatch insideTick = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        bus.subscribe(SchedulerTickStarted.class, ignored -> {
            insideTick.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        AlertExecutionService service = service(Duration.ofMinutes(1));
        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            Future<TickReport> first = runner.submit(service::runTick);
            assertTrue(insideTick.await(5, TimeUnit.SECONDS));
            assertTrue(service.state().running());

            TickReport overlapping = service.runTick();
            release.countDown();

            assertTrue(overlapping.skipped());
            assertEquals(1, first.get(5, TimeUnit.SECONDS).published());
        } finally {
            runner.shutdownNow();
        }
        assertEquals(1, liveAlerts().size());
        assertFalse(service.state().running());
        assertEquals(1, capture.byType(SchedulerTickStarted.class).size());
    }

    @Test
    void stateTracksLastRunAndProcessedCount() {
        Fixtures.organization(store, "A");
        repository.save(Fixtures.oneShot("s1", T0));
        repository.save(Fixtures.oneShot("s2", T0));
        AlertExecutionService service = service(Duration.ofMinutes(1));

        ExecutionRun before = service.state();
        service.runTick();
        ExecutionRun after = service.state();

        assertEquals(0, before.executionCount());
        assertNull(before.lastExecutionTime());
        assertEquals(2, after.executionCount());
        assertEquals(T0, after.lastExecutionTime());
        assertFalse(after.running());
    }

    @Test
    void failedDueQueryRaisesSchedulerAlertAndCompletesTick() {
        store.failOn(FaultyDocumentStore.Operation.QUERY, CollectionPaths.SCHEDULED_ALERTS);

        TickReport report = service(Duration.ofMinutes(1)).runTick();

        assertEquals(0, report.due());
        assertFalse(report.skipped());
        assertEquals(1, capture.byType(SchedulerTickCompleted.class).size());
        assertEquals("scheduler", capture.byType(AlertRaised.class).get(0).category());
    }

    @Test
    void cleanupDeactivatesExpiredAlertsOnceAndIsIdempotent() {
        ScheduledAlert future = Fixtures.oneShot("expired", T0.plus(Duration.ofDays(2)));
        repository.save(new ScheduledAlert(future.id(), future.title(), future.description(), future.organizationId(),
                future.organizationName(), null, null, future.category(), future.location(), future.scheduledDate(),
                false, null, future.poster(), true, T0.minusSeconds(1), T0, T0, List.of(), null));
        repository.save(Fixtures.oneShot("no-expiry", T0.plus(Duration.ofDays(2))));
        AlertExecutionService service = service(Duration.ofMinutes(1));

        assertEquals(1, service.cleanupExpired());
        assertEquals(0, service.cleanupExpired());

        assertFalse(repository.find("expired").orElseThrow().active());
        assertTrue(repository.find("no-expiry").orElseThrow().active());
        List<ExpiredAlertsCleaned> cleaned = capture.byType(ExpiredAlertsCleaned.class);
        assertEquals(2, cleaned.size());
        assertEquals(1, cleaned.get(0).deactivated());
        assertEquals(0, cleaned.get(1).expiredCount());
        assertNotNull(capture.byType(ScheduledAlertDeactivated.class).get(0).reason());
    }

    private AlertExecutionService service(Duration tickBudget) {
        return new AlertExecutionService(context, repository, publisher, new RecurrenceCalculator(), tickBudget);
    }

    private List<LiveAlert> liveAlerts() {
        return store.query(CollectionPaths.organizationAlerts(Fixtures.ORG_ID), Query.all()).stream()
                .map(doc -> LiveAlertCodec.fromDocument(Fixtures.ORG_ID, doc))
                .toList();
    }
}
