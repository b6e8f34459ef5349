package com.alertrelay.pipeline.codec;

import com.alertrelay.core.model.AlertCategory;
import com.alertrelay.core.model.IncidentSeverity;
import com.alertrelay.core.model.IncidentType;
import com.alertrelay.core.model.LiveAlert;
import com.alertrelay.core.model.Poster;
import com.alertrelay.pipeline.store.CollectionPaths;
import com.alertrelay.pipeline.store.ServerValue;
import com.alertrelay.pipeline.store.StoredDocument;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.alertrelay.pipeline.codec.LocationFields.putIfPresent;

public final class LiveAlertCodec {
    private LiveAlertCodec() {
    }

    public static Map<String, Object> toNewFields(LiveAlert alert) {
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
        fields.put("postedBy", alert.poster().name());
        fields.put("postedByUserId", alert.poster().userId());
        fields.put("postedAt", alert.postedAt().toEpochMilli());
        fields.put("expiresAt", alert.expiresAt().toEpochMilli());
        putIfPresent(fields, "scheduledAlertId", alert.scheduledAlertId());
        fields.put("isActive", alert.active());
        fields.put("imageURLs", alert.imageUrls());
        fields.put("createdAt", ServerValue.TIMESTAMP);
        fields.put("updatedAt", ServerValue.TIMESTAMP);
        return fields;
    }

    public static LiveAlert fromDocument(String organizationId, StoredDocument document) {
        DocumentReader reader = new DocumentReader(CollectionPaths.organizationAlerts(organizationId), document);
        return new LiveAlert(
                document.id(),
                reader.optionalString("scheduledAlertId"),
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
                new Poster(reader.requiredString("postedBy"), reader.requiredString("postedByUserId")),
                reader.requiredInstant("postedAt"),
                reader.requiredInstant("expiresAt"),
                reader.optionalBoolean("isActive", true),
                reader.stringList("imageURLs")
        );
    }
}
