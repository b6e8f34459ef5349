package com.alertrelay.pipeline.codec;

import com.alertrelay.core.model.AlertCategory;
import com.alertrelay.core.model.IncidentSeverity;
import com.alertrelay.core.model.IncidentType;
import com.alertrelay.core.model.Poster;
import com.alertrelay.core.model.RecurrenceFrequency;
import com.alertrelay.core.model.RecurrencePattern;
import com.alertrelay.core.model.ScheduledAlert;
import com.alertrelay.pipeline.store.CollectionPaths;
import com.alertrelay.pipeline.store.StoredDocument;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.alertrelay.pipeline.codec.LocationFields.putIfPresent;

public final class ScheduledAlertCodec {
    public static final String IS_ACTIVE = "isActive";
    public static final String SCHEDULED_DATE = "scheduledDate";
    public static final String EXPIRES_AT = "expiresAt";
    public static final String UPDATED_AT = "updatedAt";

    private ScheduledAlertCodec() {
    }

    public static Map<String, Object> toFields(ScheduledAlert alert) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", alert.title());
        fields.put("description", alert.description());
        fields.put("organizationId", alert.organizationId());
        fields.put("organizationName", alert.organizationName());
        putIfPresent(fields, "groupId", alert.groupId());
        putIfPresent(fields, "groupName", alert.groupName());
        fields.put("type", alert.category().type().wireValue());
        fields.put("severity", alert.category().severity().wireValue());
        if (alert.location() != null) {
            fields.put("location", LocationFields.toFields(alert.location()));
        }
        fields.put(SCHEDULED_DATE, alert.scheduledDate().toEpochMilli());
        fields.put("isRecurring", alert.recurring());
        if (alert.recurrencePattern() != null) {
            fields.put("recurrencePattern", patternFields(alert.recurrencePattern()));
        }
        fields.put("postedBy", alert.poster().name());
        fields.put("postedByUserId", alert.poster().userId());
        fields.put(IS_ACTIVE, alert.active());
        if (alert.expiresAt() != null) {
            fields.put(EXPIRES_AT, alert.expiresAt().toEpochMilli());
        }
        if (alert.createdAt() != null) {
            fields.put("createdAt", alert.createdAt().toEpochMilli());
        }
        if (alert.updatedAt() != null) {
            fields.put(UPDATED_AT, alert.updatedAt().toEpochMilli());
        }
        fields.put("imageURLs", alert.imageUrls());
        putIfPresent(fields, "calendarEventId", alert.calendarEventId());
        return fields;
    }

    public static ScheduledAlert fromDocument(StoredDocument document) {
        DocumentReader reader = new DocumentReader(CollectionPaths.SCHEDULED_ALERTS, document);
        return new ScheduledAlert(
                document.id(),
                reader.requiredString("title"),
                reader.requiredString("description"),
                reader.requiredString("organizationId"),
                reader.requiredString("organizationName"),
                reader.optionalString("groupId"),
                reader.optionalString("groupName"),
                new AlertCategory(
                        reader.decode("type", IncidentType::fromWire),
                        reader.decode("severity", IncidentSeverity::fromWire)
                ),
                LocationFields.fromFields(reader),
                reader.requiredInstant(SCHEDULED_DATE),
                reader.optionalBoolean("isRecurring", false),
                pattern(reader),
                new Poster(reader.requiredString("postedBy"), reader.requiredString("postedByUserId")),
                reader.requiredBoolean(IS_ACTIVE),
                reader.optionalInstant(EXPIRES_AT),
                reader.optionalInstant("createdAt"),
                reader.optionalInstant(UPDATED_AT),
                reader.stringList("imageURLs"),
                reader.optionalString("calendarEventId")
        );
    }

    private static Map<String, Object> patternFields(RecurrencePattern pattern) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("frequency", pattern.frequency().wireValue());
        fields.put("interval", pattern.interval());
        if (pattern.endDate() != null) {
            fields.put("endDate", pattern.endDate().toEpochMilli());
        }
        return fields;
    }

    // An empty pattern map is what older writers stored for "no pattern".
    private static RecurrencePattern pattern(DocumentReader reader) {
        return reader.nested("recurrencePattern")
                .map(nested -> new RecurrencePattern(
                        nested.decode("frequency", RecurrenceFrequency::fromWire),
                        nested.requiredInt("interval"),
                        nested.optionalInstant("endDate")
                ))
                .orElse(null);
    }
}
