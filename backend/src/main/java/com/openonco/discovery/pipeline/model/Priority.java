package com.openonco.discovery.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Digest bucket for a discovery. Device approvals and high-relevance items lead,
     * every other known source lands in the medium bucket.
     */
    public static Priority infer(DiscoverySource source, String type, Relevance relevance) {
        if (source == DiscoverySource.DEVICE_APPROVAL || "fda_approval".equals(type) || relevance == Relevance.HIGH) {
            return HIGH;
        }
        if (source != null) {
            return MEDIUM;
        }
        return LOW;
    }

    public static Priority of(Discovery discovery) {
        return infer(discovery.source(), discovery.type(), discovery.relevance());
    }
}
