package com.alertrelay.service.config;

import java.time.Duration;
import java.time.ZoneId;

public record SchedulerConfig(
        int tickIntervalSeconds,
        int cleanupIntervalSeconds,
        int tickBudgetSeconds,
        int requestTimeoutSeconds,
        int dispatchThreads,
        String recurrenceZone,
        PushGatewayConfig push,
        EmailOutboxConfig email
) {
    static final int DEFAULT_TICK_INTERVAL_SECONDS = 300;
    static final int DEFAULT_CLEANUP_INTERVAL_SECONDS = 3600;
    static final int DEFAULT_TICK_BUDGET_SECONDS = 240;
    static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 10;
    static final int DEFAULT_DISPATCH_THREADS = 8;

    public SchedulerConfig {
        tickIntervalSeconds = orDefault("tickIntervalSeconds", tickIntervalSeconds, DEFAULT_TICK_INTERVAL_SECONDS);
        cleanupIntervalSeconds = orDefault("cleanupIntervalSeconds", cleanupIntervalSeconds, DEFAULT_CLEANUP_INTERVAL_SECONDS);
        tickBudgetSeconds = orDefault("tickBudgetSeconds", tickBudgetSeconds, DEFAULT_TICK_BUDGET_SECONDS);
        requestTimeoutSeconds = orDefault("requestTimeoutSeconds", requestTimeoutSeconds, DEFAULT_REQUEST_TIMEOUT_SECONDS);
        dispatchThreads = orDefault("dispatchThreads", dispatchThreads, DEFAULT_DISPATCH_THREADS);
        recurrenceZone = recurrenceZone == null || recurrenceZone.isBlank() ? "UTC" : recurrenceZone;
        ZoneId.of(recurrenceZone);
        push = push == null ? PushGatewayConfig.logging() : push;
        email = email == null ? EmailOutboxConfig.disabled() : email;
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(0, 0, 0, 0, 0, null, null, null);
    }

    public Duration tickInterval() {
        return Duration.ofSeconds(tickIntervalSeconds);
    }

    public Duration cleanupInterval() {
        return Duration.ofSeconds(cleanupIntervalSeconds);
    }

    public Duration tickBudget() {
        return Duration.ofSeconds(tickBudgetSeconds);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public ZoneId zone() {
        return ZoneId.of(recurrenceZone);
    }

    private static int orDefault(String name, int value, int fallback) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value == 0 ? fallback : value;
    }
}
