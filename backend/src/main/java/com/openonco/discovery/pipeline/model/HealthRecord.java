package com.openonco.discovery.pipeline.model;

import java.time.Instant;

public record HealthRecord(
    Instant lastSuccess,
    Instant lastError,
    long successCount,
    long errorCount,
    String lastErrorMessage
) {
    public static HealthRecord empty() {
        return new HealthRecord(null, null, 0, 0, null);
    }

    public HealthRecord withSuccess(Instant at) {
        return new HealthRecord(at, lastError, successCount + 1, errorCount, lastErrorMessage);
    }

    public HealthRecord withError(Instant at, String message) {
        return new HealthRecord(lastSuccess, at, successCount, errorCount + 1, message);
    }
}
