package com.alertrelay.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record ScheduledAlert(
        String id,
        String title,
        String description,
        String organizationId,
        String organizationName,
        String groupId,
        String groupName,
        AlertCategory category,
        GeoLocation location,
        Instant scheduledDate,
        boolean recurring,
        RecurrencePattern recurrencePattern,
        Poster poster,
        boolean active,
        Instant expiresAt,
        Instant createdAt,
        Instant updatedAt,
        List<String> imageUrls,
        String calendarEventId
) {
    public ScheduledAlert {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(organizationName, "organizationName is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(scheduledDate, "scheduledDate is required");
        Objects.requireNonNull(poster, "poster is required");
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
    }

    public Optional<RecurrencePattern> effectivePattern() {
        if (!recurring) {
            return Optional.empty();
        }
        return Optional.ofNullable(recurrencePattern);
    }

    public Optional<String> group() {
        if (groupId == null || groupId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(groupId);
    }

}
