package com.alertrelay.pipeline.dispatch;

import java.util.Objects;

public record DeliveryOutcome(String recipientId, Status status, String reason) {
    public static final String NO_ADDRESS = "no-address";

    public enum Status {
        DELIVERED,
        SKIPPED,
        FAILED
    }

    public DeliveryOutcome {
        Objects.requireNonNull(recipientId, "recipientId is required");
        Objects.requireNonNull(status, "status is required");
    }

    public static DeliveryOutcome delivered(String recipientId) {
        return new DeliveryOutcome(recipientId, Status.DELIVERED, null);
    }

    public static DeliveryOutcome skipped(String recipientId, String reason) {
        return new DeliveryOutcome(recipientId, Status.SKIPPED, reason);
    }

    public static DeliveryOutcome failed(String recipientId, String reason) {
        return new DeliveryOutcome(recipientId, Status.FAILED, reason);
    }
}
