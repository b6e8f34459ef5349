package com.alertrelay.service;

import com.alertrelay.core.bus.EventBus;
import com.alertrelay.core.events.AlertRaised;
import com.alertrelay.core.events.Event;
import com.alertrelay.core.recurrence.RecurrenceCalculator;
import com.alertrelay.pipeline.api.IdentityProvider;
import com.alertrelay.pipeline.api.PipelineContext;
import com.alertrelay.pipeline.dispatch.NotificationDispatcher;
import com.alertrelay.pipeline.dispatch.NotificationGateway;
import com.alertrelay.pipeline.dispatch.RecipientDirectory;
import com.alertrelay.pipeline.execution.AlertExecutionService;
import com.alertrelay.pipeline.followers.FollowerResolver;
import com.alertrelay.pipeline.followers.StoredGroupPreferenceFilter;
import com.alertrelay.pipeline.publish.AlertPublisher;
import com.alertrelay.pipeline.repository.ScheduledAlertRepository;
import com.alertrelay.pipeline.store.DocumentStore;
import com.alertrelay.service.config.ConfigLoader;
import com.alertrelay.service.config.SchedulerConfig;
import com.alertrelay.service.diagnostics.DiagnosticsTracker;
import com.alertrelay.service.gateway.HttpPushGateway;
import com.alertrelay.service.gateway.LoggingPushGateway;
import com.alertrelay.service.gateway.OutboxEmailGateway;
import com.alertrelay.service.http.HttpClientFactory;
import com.alertrelay.service.runtime.SchedulerService;
import com.alertrelay.service.store.EventCodec;
import com.alertrelay.service.store.EventStore;
import com.alertrelay.service.store.JsonFileDocumentStore;
import com.alertrelay.service.store.JsonlEventStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final String CONFIG_DIR_ENV = "ALERT_RELAY_CONFIG_DIR";
    static final String DATA_DIR_ENV = "ALERT_RELAY_DATA_DIR";
    static final Duration RECENT_FAILURE_WINDOW = Duration.ofHours(24);
    static final int RECENT_FAILURE_LIMIT = 20;

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        RuntimePaths paths = resolvePaths(System.getenv());
        SchedulerConfig config = ConfigLoader.loadScheduler(paths.configDir());
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(paths.eventLogFile());
        EventCodec.subscribeAll(eventBus, eventStore::append);
        DiagnosticsTracker diagnostics = new DiagnosticsTracker(eventBus, clock);
        logRecentFailures(eventStore, clock.instant().minus(RECENT_FAILURE_WINDOW));

        JsonFileDocumentStore store = new JsonFileDocumentStore(paths.documentsFile(), clock);
        RecipientDirectory directory = new RecipientDirectory(store);
        List<NotificationGateway> gateways = gateways(config, directory, paths, clock);
        ExecutorService dispatchPool = Executors.newFixedThreadPool(config.dispatchThreads());

        AlertExecutionService executionService = assemble(config, store, eventBus, clock, gateways, dispatchPool);
        SchedulerService scheduler = new SchedulerService(
                executionService,
                eventBus,
                clock,
                config.tickInterval(),
                config.cleanupInterval()
        );
        scheduler.start();
        LOGGER.info("alert-relay running with documents at " + store.file() + " and event log at " + paths.eventLogFile());

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            dispatchPool.shutdown();
            LOGGER.info("Final metrics: " + diagnostics.metricsSnapshot());
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static AlertExecutionService assemble(
            SchedulerConfig config,
            DocumentStore store,
            EventBus eventBus,
            Clock clock,
            List<NotificationGateway> gateways,
            ExecutorService dispatchPool
    ) {
        PipelineContext context = new PipelineContext(store, eventBus, clock, config.requestTimeout());
        AlertPublisher publisher = new AlertPublisher(
                context,
                new FollowerResolver(store, new StoredGroupPreferenceFilter(store)),
                new NotificationDispatcher(gateways, dispatchPool, config.requestTimeout()),
                IdentityProvider.none()
        );
        return new AlertExecutionService(
                context,
                new ScheduledAlertRepository(store),
                publisher,
                new RecurrenceCalculator(config.zone()),
                config.tickBudget()
        );
    }

    static List<NotificationGateway> gateways(SchedulerConfig config, RecipientDirectory directory, RuntimePaths paths, Clock clock) {
        List<NotificationGateway> gateways = new ArrayList<>();
        if (config.push().http()) {
            gateways.add(new HttpPushGateway(
                    HttpClientFactory.create(Duration.ofSeconds(5)),
                    URI.create(config.push().endpoint()),
                    config.push().apiKey(),
                    config.requestTimeout(),
                    directory
            ));
        } else {
            LOGGER.info("Push mode is log; notifications are written to the log only");
            gateways.add(new LoggingPushGateway(directory));
        }
        if (config.email().enabled()) {
            gateways.add(new OutboxEmailGateway(
                    paths.dataDir().resolve(config.email().outboxFile()),
                    config.email().from(),
                    clock,
                    directory
            ));
        }
        return gateways;
    }

    static List<AlertRaised> logRecentFailures(EventStore eventStore, Instant since) {
        List<Event> events;
        try {
            events = eventStore.query(since, Optional.of("AlertRaised"), RECENT_FAILURE_LIMIT);
        } catch (IllegalStateException e) {
            LOGGER.log(Level.WARNING, "Could not read recent failures from the event log", e);
            return List.of();
        }
        List<AlertRaised> failures = new ArrayList<>();
        for (Event event : events) {
            AlertRaised raised = (AlertRaised) event;
            failures.add(raised);
            LOGGER.warning("Earlier failure at " + raised.timestamp() + " [" + raised.category() + "]: " + raised.message());
        }
        return failures;
    }

    static RuntimePaths resolvePaths(Map<String, String> env) {
        return new RuntimePaths(
                Path.of(nonBlank(env.get(CONFIG_DIR_ENV), "config")),
                Path.of(nonBlank(env.get(DATA_DIR_ENV), "data"))
        );
    }

    private static String nonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not read logging.properties; using JVM defaults", e);
        }
    }

    record RuntimePaths(Path configDir, Path dataDir) {
        Path documentsFile() {
            return dataDir.resolve("documents.json");
        }

        Path eventLogFile() {
            return dataDir.resolve("events.jsonl");
        }
    }
}
