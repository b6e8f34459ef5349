package com.alertrelay.core.model;

import java.util.Objects;

public record Poster(String name, String userId) {
    public Poster {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(userId, "userId is required");
    }

    public boolean hasUserId() {
        return !userId.isBlank();
    }
}
