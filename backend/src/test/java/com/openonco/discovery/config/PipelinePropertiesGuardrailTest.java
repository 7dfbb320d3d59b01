package com.openonco.discovery.config;

import com.openonco.discovery.pipeline.model.DiscoverySource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelinePropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        PipelineProperties properties = new PipelineProperties();
        properties.getHttp().setUserAgent("   ");
        assertTrue(properties.getHttp().getUserAgent().startsWith("openonco-discovery/0.1"));
    }

    @Test
    void numericSettingsAreClamped() {
        PipelineProperties properties = new PipelineProperties();
        properties.getHttp().setDefaultHostDelayMs(-10);
        properties.getHttp().setRequestMaxRetries(-1);
        properties.getScheduler().setPoolSize(0);
        properties.getCleanup().setMaxAgeDays(0);
        assertEquals(1, properties.getHttp().getDefaultHostDelayMs());
        assertEquals(0, properties.getHttp().getRequestMaxRetries());
        assertEquals(1, properties.getScheduler().getPoolSize());
        assertEquals(1, properties.getCleanup().getMaxAgeDays());
    }

    @Test
    void crawlerRateLimitDrivesMinimumInterval() {
        PipelineProperties.Crawler crawler = new PipelineProperties.Crawler();
        crawler.setRateLimit(0.2);
        assertEquals(5000, crawler.minIntervalMs());
        crawler.setRateLimit(0);
        assertEquals(1000, crawler.minIntervalMs());
        crawler.setBaseUrl("http://localhost:8080/");
        assertEquals("http://localhost:8080", crawler.baseUrlOr("https://example.org"));
    }

    @Test
    void missingCrawlerEntryIsDisabledOnWeeklySchedule() {
        PipelineProperties properties = new PipelineProperties();
        PipelineProperties.Crawler configured = new PipelineProperties.Crawler();
        properties.setCrawlers(Map.of("vendor", configured));

        assertTrue(properties.crawler(DiscoverySource.VENDOR).isEnabled());
        PipelineProperties.Crawler fallback = properties.crawler(DiscoverySource.PREPRINT);
        assertFalse(fallback.isEnabled());
        assertEquals("0 2 * * 0", fallback.getCron());
    }

    @Test
    void blankRecipientsAreDropped() {
        PipelineProperties properties = new PipelineProperties();
        properties.getEmail().setTo(new ArrayList<>(Arrays.asList("", " ops@openonco.org ", null)));
        assertEquals(1, properties.getEmail().getTo().size());
        assertEquals("ops@openonco.org", properties.getEmail().getTo().get(0));
    }
}
