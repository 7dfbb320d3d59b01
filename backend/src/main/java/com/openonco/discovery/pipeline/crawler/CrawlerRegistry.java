package com.openonco.discovery.pipeline.crawler;

import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.service.UnknownSourceException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class CrawlerRegistry {
    private final Map<DiscoverySource, SourceCrawler> crawlers = new EnumMap<>(DiscoverySource.class);

    public CrawlerRegistry(List<SourceCrawler> crawlers) {
        for (SourceCrawler crawler : crawlers) {
            SourceCrawler previous = this.crawlers.put(crawler.source(), crawler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate crawler for source " + crawler.source());
            }
        }
    }

    public SourceCrawler get(DiscoverySource source) {
        SourceCrawler crawler = source == null ? null : crawlers.get(source);
        if (crawler == null) {
            throw new UnknownSourceException(String.valueOf(source));
        }
        return crawler;
    }

    public SourceCrawler get(String sourceId) {
        DiscoverySource source = DiscoverySource.fromId(sourceId);
        if (source == null || !crawlers.containsKey(source)) {
            throw new UnknownSourceException(sourceId);
        }
        return crawlers.get(source);
    }

    public Collection<SourceCrawler> all() {
        return crawlers.values();
    }

    public List<SourceCrawler> enabled() {
        return crawlers.values().stream()
            .filter(SourceCrawler::isEnabled)
            .toList();
    }
}
