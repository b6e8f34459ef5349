package com.alertrelay.pipeline.api;

import com.alertrelay.core.bus.EventBus;
import com.alertrelay.pipeline.store.DocumentStore;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public record PipelineContext(
        DocumentStore store,
        EventBus eventBus,
        Clock clock,
        Duration requestTimeout
) {
    public PipelineContext {
        Objects.requireNonNull(store, "store is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }
}
