package com.alertrelay.core.events;

import java.time.Instant;

public record ExpiredAlertsCleaned(
        Instant timestamp,
        int expiredCount,
        int deactivated
) implements Event {
    @Override
    public String type() {
        return "ExpiredAlertsCleaned";
    }
}
