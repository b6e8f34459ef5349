package com.alertrelay.service.resilience;

import com.alertrelay.core.bus.EventBus;
import com.alertrelay.core.events.AlertRaised;
import com.alertrelay.service.store.EventCodec;
import com.alertrelay.service.store.JsonlEventStore;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResilienceTest {
    @Test
    void auditLogFailureDoesNotBlockOtherSubscribers() throws Exception {
        AtomicInteger handlerErrors = new AtomicInteger();
        EventBus bus = new EventBus((event, error) -> handlerErrors.incrementAndGet());
        Path blocker = Files.createTempDirectory("resilience-").resolve("blocker");
        Files.writeString(blocker, "file");
        JsonlEventStore eventStore = new JsonlEventStore(blocker.resolve("events.jsonl"));
        EventCodec.subscribeAll(bus, eventStore::append);

        AtomicInteger otherSubscriber = new AtomicInteger();
        bus.subscribe(AlertRaised.class, event -> otherSubscriber.incrementAndGet());

        bus.publish(new AlertRaised(Instant.parse("2026-03-01T08:00:00Z"), "publisher", "count drift", Map.of()));

        assertEquals(1, otherSubscriber.get());
        assertEquals(1, handlerErrors.get());
    }

    @Test
    void unserializablePayloadIsIsolatedToTheLog() throws Exception {
        AtomicInteger handlerErrors = new AtomicInteger();
        EventBus bus = new EventBus((event, error) -> handlerErrors.incrementAndGet());
        JsonlEventStore eventStore = new JsonlEventStore(Files.createTempDirectory("resilience-").resolve("events.jsonl"));
        EventCodec.subscribeAll(bus, eventStore::append);
        AtomicInteger otherSubscriber = new AtomicInteger();
        bus.subscribe(AlertRaised.class, event -> otherSubscriber.incrementAndGet());

        Map<String, Object> cyclic = new HashMap<>();
        cyclic.put("self", cyclic);
        bus.publish(new AlertRaised(Instant.parse("2026-03-01T08:00:00Z"), "dispatcher", "cyclic payload", cyclic));

        assertEquals(1, otherSubscriber.get());
        assertEquals(1, handlerErrors.get());
    }
}
