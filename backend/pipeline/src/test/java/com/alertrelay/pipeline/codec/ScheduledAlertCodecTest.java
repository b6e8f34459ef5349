package com.alertrelay.pipeline.codec;

import com.alertrelay.core.model.IncidentType;
import com.alertrelay.core.model.RecurrenceFrequency;
import com.alertrelay.core.model.RecurrencePattern;
import com.alertrelay.core.model.ScheduledAlert;
import com.alertrelay.pipeline.store.StoredDocument;
import com.alertrelay.pipeline.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduledAlertCodecTest {
    private static final Instant AT = Instant.parse("2026-02-01T09:00:00Z");

    @Test
    void writesTimestampsAsEpochMillisAndWireEnumValues() {
        RecurrencePattern weekly = RecurrencePattern.every(2, RecurrenceFrequency.WEEKLY)
                .until(Instant.parse("2026-06-01T00:00:00Z"));
        ScheduledAlert alert = Fixtures.recurring("s1", AT, weekly);

        Map<String, Object> fields = ScheduledAlertCodec.toFields(alert);

        assertEquals(AT.toEpochMilli(), fields.get("scheduledDate"));
        assertEquals("other", fields.get("type"));
        assertEquals("medium", fields.get("severity"));
        assertEquals(true, fields.get("isActive"));
        assertEquals(true, fields.get("isRecurring"));
        assertEquals(Map.of("frequency", "weekly", "interval", 2,
                "endDate", Instant.parse("2026-06-01T00:00:00Z").toEpochMilli()), fields.get("recurrencePattern"));
        assertEquals("user-poster", fields.get("postedByUserId"));
        assertFalse(fields.containsKey("groupId"));
    }

    @Test
    void readsIsoStringTimestampsAndToleratesUnknownFields() {
        Map<String, Object> fields = new LinkedHashMap<>(ScheduledAlertCodec.toFields(Fixtures.oneShot("s2", AT)));
        fields.put("scheduledDate", "2026-02-01T09:00:00Z");
        fields.put("type", "Fire");
        fields.put("groupId", "");
        fields.put("legacyFlag", 7);

        ScheduledAlert decoded = ScheduledAlertCodec.fromDocument(new StoredDocument("s2", fields));

        assertEquals("s2", decoded.id());
        assertEquals(AT, decoded.scheduledDate());
        assertEquals(IncidentType.FIRE, decoded.category().type());
        assertNull(decoded.groupId());
        assertTrue(decoded.active());
        assertTrue(decoded.effectivePattern().isEmpty());
    }

    @Test
    void missingRequiredFieldNamesTheDocument() {
        Map<String, Object> fields = new LinkedHashMap<>(ScheduledAlertCodec.toFields(Fixtures.oneShot("s3", AT)));
        fields.remove("isActive");

        DocumentDecodingException error = assertThrows(DocumentDecodingException.class,
                () -> ScheduledAlertCodec.fromDocument(new StoredDocument("s3", fields)));
        assertTrue(error.getMessage().contains("scheduledAlerts/s3"));
        assertTrue(error.getMessage().contains("isActive"));
    }

    @Test
    void unknownSeverityIsRejected() {
        Map<String, Object> fields = new LinkedHashMap<>(ScheduledAlertCodec.toFields(Fixtures.oneShot("s4", AT)));
        fields.put("severity", "apocalyptic");

        assertThrows(DocumentDecodingException.class,
                () -> ScheduledAlertCodec.fromDocument(new StoredDocument("s4", fields)));
    }

    @Test
    void integralIntervalStoredAsDoubleIsAccepted() {
        ScheduledAlert decoded = ScheduledAlertCodec.fromDocument(withInterval("s5", 2.0));

        assertEquals(2, decoded.recurrencePattern().interval());
    }

    @Test
    void fractionalIntervalIsRejected() {
        DocumentDecodingException error = assertThrows(DocumentDecodingException.class,
                () -> ScheduledAlertCodec.fromDocument(withInterval("s6", 1.5)));

        assertTrue(error.getMessage().contains("interval"));
        assertTrue(error.getMessage().contains("scheduledAlerts/s6"));
    }

    @Test
    void intervalOutsideIntRangeIsRejected() {
        assertThrows(DocumentDecodingException.class,
                () -> ScheduledAlertCodec.fromDocument(withInterval("s7", 3_000_000_000L)));
    }

    private static StoredDocument withInterval(String id, Number interval) {
        Map<String, Object> fields = new LinkedHashMap<>(ScheduledAlertCodec.toFields(
                Fixtures.recurring(id, AT, RecurrencePattern.every(1, RecurrenceFrequency.DAILY))));
        fields.put("recurrencePattern", Map.of("frequency", "daily", "interval", interval));
        return new StoredDocument(id, fields);
    }
}
