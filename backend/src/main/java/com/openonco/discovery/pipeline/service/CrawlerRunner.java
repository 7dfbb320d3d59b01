package com.openonco.discovery.pipeline.service;

import com.openonco.discovery.pipeline.crawler.SourceCrawler;
import com.openonco.discovery.pipeline.model.CrawlResult;
import com.openonco.discovery.pipeline.model.DiscoveryCandidate;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Runs one crawler, queues what it found and records its health exactly once. Never throws.
 * The crawler's own state is committed only once its discoveries are stored, and discarded otherwise.
 */
@Service
public class CrawlerRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlerRunner.class);

    private final DiscoveryQueueService queueService;
    private final CrawlerHealthService healthService;

    public CrawlerRunner(DiscoveryQueueService queueService, CrawlerHealthService healthService) {
        this.queueService = queueService;
        this.healthService = healthService;
    }

    public CrawlResult run(SourceCrawler crawler) {
        DiscoverySource source = crawler.source();
        long startedAt = System.nanoTime();
        log.info("Starting crawl for {}", source);
        CrawlResult result;
        try {
            List<DiscoveryCandidate> discoveries = crawler.crawl();
            List<DiscoveryCandidate> safe = discoveries == null ? List.of() : discoveries;
            int added = (int) queueService.addDiscoveries(safe).stream().filter(Boolean::booleanValue).count();
            crawler.commitState();
            result = CrawlResult.success(source, safe, added, elapsed(startedAt));
            log.info(
                "Crawl for {} completed: found={}, added={}, duration={}ms",
                source,
                result.found(),
                added,
                result.duration().toMillis()
            );
        } catch (Exception e) {
            discardState(crawler);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            result = CrawlResult.failure(source, elapsed(startedAt), message);
            log.warn("Crawl for {} failed after {}ms: {}", source, result.duration().toMillis(), message, e);
        }
        recordHealth(result);
        return result;
    }

    private void discardState(SourceCrawler crawler) {
        try {
            crawler.discardState();
        } catch (Exception e) {
            log.warn("Failed to discard crawl state for {}", crawler.source(), e);
        }
    }

    private void recordHealth(CrawlResult result) {
        try {
            if (result.success()) {
                healthService.recordSuccess(result.source());
            } else {
                healthService.recordError(result.source(), result.error());
            }
        } catch (Exception e) {
            log.warn("Failed to record health for {}", result.source(), e);
        }
    }

    private Duration elapsed(long startedAt) {
        return Duration.ofNanos(System.nanoTime() - startedAt);
    }
}
