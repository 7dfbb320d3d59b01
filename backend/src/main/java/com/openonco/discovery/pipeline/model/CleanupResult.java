package com.openonco.discovery.pipeline.model;

public record CleanupResult(int removed, int remaining, int maxAgeDays) {
}
