package com.alertrelay.pipeline.api;

import java.util.Objects;

public record Identity(String id, String email, String displayName) {
    public Identity {
        Objects.requireNonNull(id, "id is required");
    }
}
