package com.alertrelay.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record LiveAlert(
        String id,
        String scheduledAlertId,
        String title,
        String description,
        String organizationId,
        String organizationName,
        String groupId,
        String groupName,
        AlertCategory category,
        GeoLocation location,
        Poster poster,
        Instant postedAt,
        Instant expiresAt,
        boolean active,
        List<String> imageUrls
) {
    public static final Duration TIME_TO_LIVE = Duration.ofDays(14);

    public LiveAlert {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(organizationName, "organizationName is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(poster, "poster is required");
        Objects.requireNonNull(postedAt, "postedAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
    }

    public static LiveAlert fromScheduled(String id, ScheduledAlert source, Instant postedAt) {
        return new LiveAlert(
                id,
                source.id(),
                source.title(),
                source.description(),
                source.organizationId(),
                source.organizationName(),
                source.group().orElse(null),
                source.group().isPresent() ? source.groupName() : null,
                source.category(),
                source.location(),
                source.poster(),
                postedAt,
                postedAt.plus(TIME_TO_LIVE),
                true,
                source.imageUrls()
        );
    }

}
