package com.alertrelay.pipeline.execution;

import java.time.Instant;

public record TickReport(
        Instant startedAt,
        boolean skipped,
        int due,
        int published,
        int failed,
        int rescheduled,
        int deactivated,
        int abandoned,
        long durationMillis
) {
    static TickReport skipped(Instant at) {
        return new TickReport(at, true, 0, 0, 0, 0, 0, 0, 0);
    }

    public int processed() {
        return published + failed;
    }
}
