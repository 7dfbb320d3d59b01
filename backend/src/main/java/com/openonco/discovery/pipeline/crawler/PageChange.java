package com.openonco.discovery.pipeline.crawler;

import java.util.List;

public record PageChange(String hash, boolean firstCapture, boolean changed, List<String> newItems) {
    public PageChange {
        newItems = newItems == null ? List.of() : List.copyOf(newItems);
    }

    public static PageChange unchanged(String hash) {
        return new PageChange(hash, false, false, List.of());
    }

    public static PageChange captured(String hash) {
        return new PageChange(hash, true, true, List.of());
    }
}
