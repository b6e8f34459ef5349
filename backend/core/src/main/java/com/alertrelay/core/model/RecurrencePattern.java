package com.alertrelay.core.model;

import java.time.Instant;
import java.util.Objects;

// Interval is validated by the calculator, not here; stored records may carry a bad value.
public record RecurrencePattern(RecurrenceFrequency frequency, int interval, Instant endDate) {
    public RecurrencePattern {
        Objects.requireNonNull(frequency, "frequency is required");
    }

    public static RecurrencePattern every(int interval, RecurrenceFrequency frequency) {
        return new RecurrencePattern(frequency, interval, null);
    }

    public RecurrencePattern until(Instant end) {
        return new RecurrencePattern(frequency, interval, end);
    }
}
