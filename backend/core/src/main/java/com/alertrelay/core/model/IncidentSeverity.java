package com.alertrelay.core.model;

import java.util.Locale;

public enum IncidentSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IncidentSeverity fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Incident severity is required");
        }
        return IncidentSeverity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
