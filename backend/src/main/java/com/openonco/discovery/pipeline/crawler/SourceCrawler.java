package com.openonco.discovery.pipeline.crawler;

import com.openonco.discovery.pipeline.model.DiscoveryCandidate;
import com.openonco.discovery.pipeline.model.DiscoverySource;

import java.util.List;

/**
 * One external data source. Implementations skip individual failed requests and only throw when
 * the crawl as a whole cannot proceed.
 */
public interface SourceCrawler {
    String name();

    DiscoverySource source();

    /**
     * Requests per second allowed against the source.
     */
    double rateLimit();

    boolean isEnabled();

    List<DiscoveryCandidate> crawl();

    /**
     * Called after the discoveries of the last {@link #crawl()} are stored. Crawlers that remember
     * what they have seen persist that state here, never during the crawl itself.
     */
    default void commitState() {
    }

    /**
     * Called when the last crawl, or storing its discoveries, failed. Anything staged is dropped so
     * the next crawl sees the same changes again.
     */
    default void discardState() {
    }
}
