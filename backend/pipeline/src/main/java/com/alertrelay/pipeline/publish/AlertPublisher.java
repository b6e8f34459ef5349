package com.alertrelay.pipeline.publish;

import com.alertrelay.core.events.AlertRaised;
import com.alertrelay.core.events.FanOutCompleted;
import com.alertrelay.core.events.LiveAlertPublished;
import com.alertrelay.core.model.LiveAlert;
import com.alertrelay.core.model.ScheduledAlert;
import com.alertrelay.pipeline.api.Identity;
import com.alertrelay.pipeline.api.IdentityProvider;
import com.alertrelay.pipeline.api.PipelineContext;
import com.alertrelay.pipeline.codec.LiveAlertCodec;
import com.alertrelay.pipeline.dispatch.FanOutReport;
import com.alertrelay.pipeline.dispatch.NotificationDispatcher;
import com.alertrelay.pipeline.followers.FollowerResolver;
import com.alertrelay.pipeline.store.CollectionPaths;
import com.alertrelay.pipeline.store.PersistenceException;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

public class AlertPublisher {
    public static final String ALERT_COUNT_FIELD = "alertCount";

    private static final Logger LOGGER = Logger.getLogger(AlertPublisher.class.getName());

    private final PipelineContext context;
    private final FollowerResolver followerResolver;
    private final NotificationDispatcher dispatcher;
    private final IdentityProvider identityProvider;

    public AlertPublisher(
            PipelineContext context,
            FollowerResolver followerResolver,
            NotificationDispatcher dispatcher,
            IdentityProvider identityProvider
    ) {
        this.context = Objects.requireNonNull(context, "context is required");
        this.followerResolver = Objects.requireNonNull(followerResolver, "followerResolver is required");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher is required");
        this.identityProvider = Objects.requireNonNull(identityProvider, "identityProvider is required");
    }

    /**
     * @throws PersistenceException if the live alert or the counter increment could not be written;
     *         no notification is sent in that case
     */
    public LiveAlert publish(ScheduledAlert scheduled) {
        String collection = CollectionPaths.organizationAlerts(scheduled.organizationId());
        Instant postedAt = context.clock().instant();
        LiveAlert alert = LiveAlert.fromScheduled(context.store().newId(collection), scheduled, postedAt);

        try {
            context.store().set(collection, alert.id(), LiveAlertCodec.toNewFields(alert), false);
        } catch (PersistenceException e) {
            throw new PersistenceException("Failed to store live alert for scheduled alert " + scheduled.id(), e);
        }
        incrementAlertCount(alert);
        LOGGER.info("Published alert " + alert.id() + " for scheduled alert " + scheduled.id()
                + " in organization " + scheduled.organizationId());
        context.eventBus().publish(new LiveAlertPublished(
                context.clock().instant(),
                alert.id(),
                scheduled.id(),
                alert.organizationId(),
                alert.title()
        ));

        fanOut(alert);
        return alert;
    }

    private void incrementAlertCount(LiveAlert alert) {
        try {
            context.store().atomicIncrement(CollectionPaths.ORGANIZATIONS, alert.organizationId(), ALERT_COUNT_FIELD, 1);
        } catch (PersistenceException e) {
            throw new PersistenceException("Failed to increment alert count of organization " + alert.organizationId()
                    + " after storing alert " + alert.id(), e);
        }
    }

    private void fanOut(LiveAlert alert) {
        try {
            Set<String> recipients = followerResolver.eligibleRecipients(
                    alert.organizationId(),
                    alert.organizationName(),
                    posterId(alert),
                    alert.groupId()
            );
            FanOutReport report = dispatcher.fanOut(recipients, alert);
            LOGGER.info("Fan-out for alert " + alert.id() + ": attempted=" + report.attempted()
                    + " delivered=" + report.delivered() + " skipped=" + report.skipped() + " failed=" + report.failed());
            context.eventBus().publish(new FanOutCompleted(
                    context.clock().instant(),
                    alert.id(),
                    alert.organizationId(),
                    report.attempted(),
                    report.delivered(),
                    report.skipped(),
                    report.failed()
            ));
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Fan-out failed for alert " + alert.id(), e);
            raise("dispatcher", "Fan-out failed for alert " + alert.id() + ": " + e.getMessage(), Map.of(
                    "organizationId", alert.organizationId(),
                    "alertId", alert.id()
            ));
        }
    }

    private String posterId(LiveAlert alert) {
        if (alert.poster().hasUserId()) {
            return alert.poster().userId();
        }
        return identityProvider.currentIdentity().map(Identity::id).orElse(null);
    }

    private void raise(String category, String message, Map<String, Object> details) {
        context.eventBus().publish(new AlertRaised(context.clock().instant(), category, message, details));
    }
}
