package com.openonco.discovery.pipeline.model;

public record CrawlerStatus(
    DiscoverySource source,
    String name,
    boolean enabled,
    double rateLimit,
    String cron,
    HealthRecord health
) {
}
