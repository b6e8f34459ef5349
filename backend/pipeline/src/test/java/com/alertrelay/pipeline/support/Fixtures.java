package com.alertrelay.pipeline.support;

import com.alertrelay.core.model.AlertCategory;
import com.alertrelay.core.model.GeoLocation;
import com.alertrelay.core.model.IncidentSeverity;
import com.alertrelay.core.model.IncidentType;
import com.alertrelay.core.model.Poster;
import com.alertrelay.core.model.RecurrencePattern;
import com.alertrelay.core.model.ScheduledAlert;
import com.alertrelay.pipeline.store.CollectionPaths;
import com.alertrelay.pipeline.store.DocumentStore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Fixtures {
    public static final String ORG_ID = "org-1";
    public static final String ORG_NAME = "City Works";
    public static final String POSTER_ID = "user-poster";

    private Fixtures() {
    }

    public static ScheduledAlert oneShot(String id, Instant scheduledDate) {
        return alert(id, scheduledDate, false, null, null);
    }

    public static ScheduledAlert recurring(String id, Instant scheduledDate, RecurrencePattern pattern) {
        return alert(id, scheduledDate, true, pattern, null);
    }

    public static ScheduledAlert alert(
            String id,
            Instant scheduledDate,
            boolean recurring,
            RecurrencePattern pattern,
            String groupId
    ) {
        return new ScheduledAlert(
                id,
                "Hydrant flushing",
                "Expect low water pressure on Elm St.",
                ORG_ID,
                ORG_NAME,
                groupId,
                groupId == null ? null : "Group " + groupId,
                new AlertCategory(IncidentType.OTHER, IncidentSeverity.MEDIUM),
                GeoLocation.of(42.36, -71.06),
                scheduledDate,
                recurring,
                pattern,
                new Poster("Dana", POSTER_ID),
                true,
                null,
                scheduledDate.minusSeconds(3600),
                scheduledDate.minusSeconds(3600),
                List.of(),
                null
        );
    }

    public static void organization(DocumentStore store, String... followerIds) {
        Map<String, Object> followers = new LinkedHashMap<>();
        for (String followerId : followerIds) {
            followers.put(followerId, true);
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", ORG_NAME);
        fields.put("followers", followers);
        store.set(CollectionPaths.ORGANIZATIONS, ORG_ID, fields, false);
    }

    public static void user(DocumentStore store, String userId, String pushToken, String email) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (pushToken != null) {
            fields.put("fcmToken", pushToken);
        }
        if (email != null) {
            fields.put("email", email);
        }
        store.set(CollectionPaths.USERS, userId, fields, false);
    }

    public static void groupPreference(DocumentStore store, String userId, String groupId, boolean enabled) {
        store.set(
                CollectionPaths.followedOrganizations(userId),
                ORG_ID,
                Map.of("groupPreferences", Map.of(groupId, enabled)),
                true
        );
    }
}
