package com.alertrelay.core.events;

import java.time.Instant;

public record ScheduledAlertRescheduled(
        Instant timestamp,
        String scheduledAlertId,
        Instant nextScheduledDate
) implements Event {
    @Override
    public String type() {
        return "ScheduledAlertRescheduled";
    }
}
