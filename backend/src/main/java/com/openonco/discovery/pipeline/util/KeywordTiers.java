package com.openonco.discovery.pipeline.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Ordered keyword tables for one source. Entries are stored lower-cased.
 */
public record KeywordTiers(List<String> high, List<String> medium) {
    public KeywordTiers {
        high = normalize(high);
        medium = normalize(medium);
    }

    public static KeywordTiers of(List<String> high, List<String> medium) {
        return new KeywordTiers(high, medium);
    }

    /**
     * Returns a copy whose high tier is extended with extra terms, appended after the existing ones.
     */
    public KeywordTiers withExtraHigh(Collection<String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(high);
        merged.addAll(extra);
        return new KeywordTiers(merged, medium);
    }

    private static List<String> normalize(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(value -> value.trim().toLowerCase(Locale.ROOT))
            .distinct()
            .toList();
    }
}
