package com.alertrelay.core.events;

import java.time.Instant;

public record SchedulerTickCompleted(
        Instant timestamp,
        int dueCount,
        int published,
        int failed,
        int abandoned,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SchedulerTickCompleted";
    }
}
