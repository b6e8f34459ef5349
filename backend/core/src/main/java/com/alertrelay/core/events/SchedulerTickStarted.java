package com.alertrelay.core.events;

import java.time.Instant;

public record SchedulerTickStarted(
        Instant timestamp,
        long executionNumber
) implements Event {
    @Override
    public String type() {
        return "SchedulerTickStarted";
    }
}
