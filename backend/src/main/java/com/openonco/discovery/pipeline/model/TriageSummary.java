package com.openonco.discovery.pipeline.model;

import java.util.Map;

public record TriageSummary(
    int pending,
    Map<Priority, Integer> byPriority,
    Map<String, Integer> bySource
) {
}
