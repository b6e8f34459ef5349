package com.alertrelay.pipeline.dispatch;

import com.alertrelay.core.model.LiveAlert;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class NotificationDispatcher {
    private static final Logger LOGGER = Logger.getLogger(NotificationDispatcher.class.getName());

    private final List<NotificationGateway> gateways;
    private final Executor executor;
    private final Duration requestTimeout;

    public NotificationDispatcher(List<NotificationGateway> gateways, Executor executor, Duration requestTimeout) {
        this.gateways = List.copyOf(gateways);
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout is required");
    }

    public DeliveryOutcome notify(String recipientId, LiveAlert alert) {
        NotificationContent content = NotificationContent.forAlert(alert);
        boolean sent = false;
        List<String> failures = new ArrayList<>();
        for (NotificationGateway gateway : gateways) {
            try {
                Optional<String> target = gateway.resolveTarget(recipientId);
                if (target.isEmpty()) {
                    continue;
                }
                gateway.send(target.get(), content);
                sent = true;
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, gateway.channel() + " delivery failed for recipient " + recipientId
                        + " of alert " + alert.id(), e);
                failures.add(gateway.channel() + ": " + rootMessage(e));
            }
        }
        if (sent) {
            return DeliveryOutcome.delivered(recipientId);
        }
        if (!failures.isEmpty()) {
            return DeliveryOutcome.failed(recipientId, String.join("; ", failures));
        }
        return DeliveryOutcome.skipped(recipientId, DeliveryOutcome.NO_ADDRESS);
    }

    public FanOutReport fanOut(Set<String> recipientIds, LiveAlert alert) {
        if (recipientIds.isEmpty()) {
            return FanOutReport.empty(alert.id());
        }
        List<CompletableFuture<DeliveryOutcome>> tasks = recipientIds.stream()
                .map(recipientId -> CompletableFuture.supplyAsync(() -> notify(recipientId, alert), executor)
                        .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                        .exceptionally(error -> DeliveryOutcome.failed(recipientId, rootMessage(error))))
                .toList();

        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();
        List<DeliveryOutcome> outcomes = tasks.stream().map(CompletableFuture::join).toList();
        return new FanOutReport(alert.id(), outcomes);
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
