package com.alertrelay.core.model;

import java.util.Locale;

public enum IncidentType {
    WEATHER,
    ROAD,
    FIRE,
    POLICE,
    MEDICAL,
    EMERGENCY,
    OTHER;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IncidentType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Incident type is required");
        }
        return IncidentType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
