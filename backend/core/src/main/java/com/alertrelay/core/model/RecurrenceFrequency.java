package com.alertrelay.core.model;

import java.util.Locale;

public enum RecurrenceFrequency {
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RecurrenceFrequency fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Recurrence frequency is required");
        }
        return RecurrenceFrequency.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
