package com.openonco.discovery.pipeline.model;

import java.util.Map;

/**
 * A crawler's view of an upstream item before the queue assigns an id and timestamps.
 */
public record DiscoveryCandidate(
    DiscoverySource source,
    String type,
    String title,
    String summary,
    String url,
    Relevance relevance,
    Map<String, Object> metadata
) {
    public DiscoveryCandidate {
        metadata = metadata == null ? Map.of() : metadata;
        relevance = relevance == null ? Relevance.LOW : relevance;
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
