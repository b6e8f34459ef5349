package com.alertrelay.pipeline.repository;

import com.alertrelay.core.model.ScheduledAlert;
import com.alertrelay.pipeline.api.NotFoundException;
import com.alertrelay.pipeline.codec.DocumentDecodingException;
import com.alertrelay.pipeline.codec.ScheduledAlertCodec;
import com.alertrelay.pipeline.store.DocumentNotFoundException;
import com.alertrelay.pipeline.store.DocumentStore;
import com.alertrelay.pipeline.store.Query;
import com.alertrelay.pipeline.store.ServerValue;
import com.alertrelay.pipeline.store.StoredDocument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.alertrelay.pipeline.codec.ScheduledAlertCodec.EXPIRES_AT;
import static com.alertrelay.pipeline.codec.ScheduledAlertCodec.IS_ACTIVE;
import static com.alertrelay.pipeline.codec.ScheduledAlertCodec.SCHEDULED_DATE;
import static com.alertrelay.pipeline.codec.ScheduledAlertCodec.UPDATED_AT;
import static com.alertrelay.pipeline.store.CollectionPaths.SCHEDULED_ALERTS;

public class ScheduledAlertRepository {
    private static final Logger LOGGER = Logger.getLogger(ScheduledAlertRepository.class.getName());

    private final DocumentStore store;

    public ScheduledAlertRepository(DocumentStore store) {
        this.store = Objects.requireNonNull(store, "store is required");
    }

    public List<ScheduledAlert> dueAlerts(Instant now) {
        Query due = Query.where(IS_ACTIVE, Query.Operator.EQ, true)
                .and(SCHEDULED_DATE, Query.Operator.LTE, now)
                .orderBy(SCHEDULED_DATE);
        return decodeAll(store.query(SCHEDULED_ALERTS, due));
    }

    public List<ScheduledAlert> expiredActiveAlerts(Instant now) {
        Query expired = Query.where(IS_ACTIVE, Query.Operator.EQ, true)
                .and(EXPIRES_AT, Query.Operator.LT, now);
        return decodeAll(store.query(SCHEDULED_ALERTS, expired));
    }

    public Optional<ScheduledAlert> find(String alertId) {
        return store.get(SCHEDULED_ALERTS, alertId).map(ScheduledAlertCodec::fromDocument);
    }

    public void save(ScheduledAlert alert) {
        store.set(SCHEDULED_ALERTS, alert.id(), ScheduledAlertCodec.toFields(alert), false);
    }

    public void persistNextOccurrence(ScheduledAlert alert, Instant nextDate) {
        Objects.requireNonNull(nextDate, "nextDate is required");
        try {
            store.update(SCHEDULED_ALERTS, alert.id(), Map.of(
                    SCHEDULED_DATE, nextDate,
                    UPDATED_AT, ServerValue.TIMESTAMP
            ));
        } catch (DocumentNotFoundException e) {
            throw new NotFoundException("Scheduled alert " + alert.id() + " no longer exists", e);
        }
    }

    /**
     * Marks the alert inactive. Deactivating an inactive record writes nothing.
     *
     * @return true if the record changed
     * @throws NotFoundException if the record does not exist
     */
    public boolean deactivate(String alertId) {
        StoredDocument current = store.get(SCHEDULED_ALERTS, alertId)
                .orElseThrow(() -> new NotFoundException("Scheduled alert " + alertId + " does not exist"));
        if (Boolean.FALSE.equals(current.get(IS_ACTIVE))) {
            return false;
        }
        try {
            store.update(SCHEDULED_ALERTS, alertId, Map.of(
                    IS_ACTIVE, false,
                    UPDATED_AT, ServerValue.TIMESTAMP
            ));
        } catch (DocumentNotFoundException e) {
            throw new NotFoundException("Scheduled alert " + alertId + " was removed during deactivation", e);
        }
        return true;
    }

    private List<ScheduledAlert> decodeAll(List<StoredDocument> documents) {
        List<ScheduledAlert> alerts = new ArrayList<>(documents.size());
        for (StoredDocument document : documents) {
            try {
                alerts.add(ScheduledAlertCodec.fromDocument(document));
            } catch (DocumentDecodingException | IllegalArgumentException e) {
                LOGGER.log(Level.WARNING, "Skipping undecodable scheduled alert " + document.id(), e);
            }
        }
        return alerts;
    }
}
