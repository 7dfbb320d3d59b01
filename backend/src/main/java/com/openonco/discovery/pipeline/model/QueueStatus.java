package com.openonco.discovery.pipeline.model;

import java.util.Map;

public record QueueStatus(
    int total,
    int pending,
    int reviewed,
    Map<String, Integer> bySource,
    Map<String, HealthRecord> health
) {
}
