package com.openonco.discovery.pipeline.model;

import java.time.Duration;

public record StageResult(
    String stage,
    boolean success,
    int found,
    int added,
    int failed,
    Duration duration,
    String error
) {
}
