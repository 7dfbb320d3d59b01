package com.openonco.discovery.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DiscoverySource {
    COVERAGE_REGISTRY("coverage-registry"),
    VENDOR("vendor"),
    PAYER("payer"),
    LITERATURE("literature"),
    PREPRINT("preprint"),
    DEVICE_APPROVAL("device-approval");

    private final String id;

    DiscoverySource(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Resolves a source by its id, accepting the enum name as well. Returns null when nothing matches.
     */
    @JsonCreator
    public static DiscoverySource fromId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (DiscoverySource source : values()) {
            if (source.id.equals(normalized)) {
                return source;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return id;
    }
}
