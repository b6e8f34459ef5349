package com.alertrelay.pipeline.execution;

import java.time.Instant;

public record ExecutionRun(boolean running, Instant lastExecutionTime, long executionCount) {
}
