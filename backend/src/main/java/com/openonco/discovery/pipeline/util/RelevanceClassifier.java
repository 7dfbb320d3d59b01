package com.openonco.discovery.pipeline.util;

import com.openonco.discovery.pipeline.model.Relevance;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

public final class RelevanceClassifier {

    private RelevanceClassifier() {
    }

    /**
     * Case-insensitive substring match, high tier first. The first matching keyword decides the tier.
     */
    public static Relevance classify(String text, KeywordTiers tiers) {
        if (text == null || text.isBlank() || tiers == null) {
            return Relevance.LOW;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (firstMatch(lower, tiers.high()) != null) {
            return Relevance.HIGH;
        }
        if (firstMatch(lower, tiers.medium()) != null) {
            return Relevance.MEDIUM;
        }
        return Relevance.LOW;
    }

    public static boolean containsAny(String text, List<String> keywords) {
        if (text == null || text.isBlank() || keywords == null) {
            return false;
        }
        return firstMatch(text.toLowerCase(Locale.ROOT), keywords) != null;
    }

    public static List<String> matching(String text, List<String> keywords) {
        if (text == null || text.isBlank() || keywords == null) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.stream()
            .filter(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)))
            .toList();
    }

    /**
     * Joins the non-blank parts with single spaces.
     */
    public static String joinText(String... parts) {
        if (parts == null) {
            return "";
        }
        return Arrays.stream(parts)
            .filter(Objects::nonNull)
            .filter(part -> !part.isBlank())
            .collect(Collectors.joining(" "));
    }

    private static String firstMatch(String lower, List<String> keywords) {
        for (String keyword : keywords) {
            if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                return keyword;
            }
        }
        return null;
    }
}
