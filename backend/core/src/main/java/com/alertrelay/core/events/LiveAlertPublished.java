package com.alertrelay.core.events;

import java.time.Instant;

public record LiveAlertPublished(
        Instant timestamp,
        String alertId,
        String scheduledAlertId,
        String organizationId,
        String title
) implements Event {
    @Override
    public String type() {
        return "LiveAlertPublished";
    }
}
