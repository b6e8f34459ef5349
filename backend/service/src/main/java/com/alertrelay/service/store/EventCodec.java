package com.alertrelay.service.store;

import com.alertrelay.core.bus.EventBus;
import com.alertrelay.core.events.AlertRaised;
import com.alertrelay.core.events.Event;
import com.alertrelay.core.events.ExpiredAlertsCleaned;
import com.alertrelay.core.events.FanOutCompleted;
import com.alertrelay.core.events.LiveAlertPublished;
import com.alertrelay.core.events.ScheduledAlertDeactivated;
import com.alertrelay.core.events.ScheduledAlertRescheduled;
import com.alertrelay.core.events.SchedulerTickCompleted;
import com.alertrelay.core.events.SchedulerTickStarted;
import com.alertrelay.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "SchedulerTickStarted", SchedulerTickStarted.class,
            "SchedulerTickCompleted", SchedulerTickCompleted.class,
            "LiveAlertPublished", LiveAlertPublished.class,
            "FanOutCompleted", FanOutCompleted.class,
            "ScheduledAlertRescheduled", ScheduledAlertRescheduled.class,
            "ScheduledAlertDeactivated", ScheduledAlertDeactivated.class,
            "ExpiredAlertsCleaned", ExpiredAlertsCleaned.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        if (!TYPES.containsKey(event.type())) {
            throw new IllegalArgumentException("Unsupported event type: " + event.type());
        }
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        bus.subscribeAll(event -> {
            if (TYPES.containsKey(event.type())) {
                consumer.accept(event);
            }
        });
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
