package com.openonco.discovery.pipeline.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record DigestReport(
    Instant generatedAt,
    QueueStatus queueStatus,
    Map<Priority, Map<DiscoverySource, List<Discovery>>> grouped
) {
    public int count(Priority priority) {
        Map<DiscoverySource, List<Discovery>> bySource = grouped.get(priority);
        if (bySource == null) {
            return 0;
        }
        return bySource.values().stream().mapToInt(List::size).sum();
    }
}
