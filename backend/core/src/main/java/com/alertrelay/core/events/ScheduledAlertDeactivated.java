package com.alertrelay.core.events;

import java.time.Instant;

public record ScheduledAlertDeactivated(
        Instant timestamp,
        String scheduledAlertId,
        String reason
) implements Event {
    @Override
    public String type() {
        return "ScheduledAlertDeactivated";
    }
}
