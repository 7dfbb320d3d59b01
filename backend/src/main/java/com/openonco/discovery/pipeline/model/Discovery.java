package com.openonco.discovery.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Map;

public record Discovery(
    String id,
    DiscoverySource source,
    String type,
    String title,
    String summary,
    String url,
    Relevance relevance,
    Map<String, Object> metadata,
    Instant discoveredAt,
    DiscoveryStatus status,
    Instant reviewedAt,
    String reviewNotes
) {
    public Discovery {
        metadata = metadata == null ? Map.of() : metadata;
        relevance = relevance == null ? Relevance.LOW : relevance;
        status = status == null ? DiscoveryStatus.PENDING : status;
    }

    public static Discovery pending(String id, DiscoveryCandidate candidate, Instant discoveredAt) {
        return new Discovery(
            id,
            candidate.source(),
            candidate.type(),
            candidate.title(),
            candidate.summary(),
            candidate.url(),
            candidate.relevance(),
            candidate.metadata(),
            discoveredAt,
            DiscoveryStatus.PENDING,
            null,
            null
        );
    }

    @JsonIgnore
    public boolean isPending() {
        return status == DiscoveryStatus.PENDING;
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    public Discovery reviewed(Instant at, String notes) {
        return new Discovery(
            id, source, type, title, summary, url, relevance, metadata,
            discoveredAt, DiscoveryStatus.REVIEWED, at, notes
        );
    }
}
