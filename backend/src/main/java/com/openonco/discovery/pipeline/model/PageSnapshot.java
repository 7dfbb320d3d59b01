package com.openonco.discovery.pipeline.model;

import java.time.Instant;
import java.util.List;

/**
 * Last observed state of a monitored web page: content hash plus the item keys seen on it.
 */
public record PageSnapshot(String hash, List<String> items, Instant capturedAt) {
    public PageSnapshot {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
