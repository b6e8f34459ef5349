package com.alertrelay.core.model;

import java.util.Objects;

public record AlertCategory(IncidentType type, IncidentSeverity severity) {
    public AlertCategory {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(severity, "severity is required");
    }
}
