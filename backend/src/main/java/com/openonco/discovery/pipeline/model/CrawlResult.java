package com.openonco.discovery.pipeline.model;

import java.time.Duration;
import java.util.List;

public record CrawlResult(
    DiscoverySource source,
    boolean success,
    List<DiscoveryCandidate> discoveries,
    int added,
    Duration duration,
    String error
) {
    public static CrawlResult success(DiscoverySource source, List<DiscoveryCandidate> discoveries, int added, Duration duration) {
        return new CrawlResult(source, true, List.copyOf(discoveries), added, duration, null);
    }

    public static CrawlResult failure(DiscoverySource source, Duration duration, String error) {
        return new CrawlResult(source, false, List.of(), 0, duration, error);
    }

    public int found() {
        return discoveries == null ? 0 : discoveries.size();
    }
}
