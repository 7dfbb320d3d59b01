package com.openonco.discovery.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Relevance {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Relevance fromId(String value) {
        if (value == null || value.isBlank()) {
            return LOW;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
