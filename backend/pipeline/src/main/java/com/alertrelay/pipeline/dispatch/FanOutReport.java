package com.alertrelay.pipeline.dispatch;

import java.util.List;

public record FanOutReport(String alertId, List<DeliveryOutcome> outcomes) {
    public FanOutReport {
        outcomes = List.copyOf(outcomes);
    }

    public static FanOutReport empty(String alertId) {
        return new FanOutReport(alertId, List.of());
    }

    public int attempted() {
        return outcomes.size();
    }

    public int delivered() {
        return count(DeliveryOutcome.Status.DELIVERED);
    }

    public int skipped() {
        return count(DeliveryOutcome.Status.SKIPPED);
    }

    public int failed() {
        return count(DeliveryOutcome.Status.FAILED);
    }

    private int count(DeliveryOutcome.Status status) {
        return (int) outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }
}
