package com.alertrelay.core.events;

import java.time.Instant;

public record FanOutCompleted(
        Instant timestamp,
        String alertId,
        String organizationId,
        int attempted,
        int delivered,
        int skipped,
        int failed
) implements Event {
    @Override
    public String type() {
        return "FanOutCompleted";
    }
}
