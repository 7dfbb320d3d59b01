package com.openonco.discovery.pipeline.crawler;

import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.http.SourceFetchException;
import com.openonco.discovery.pipeline.http.SourceHttpFetcher;
import com.openonco.discovery.pipeline.model.DiscoveryCandidate;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.model.Relevance;
import com.openonco.discovery.pipeline.util.HashUtils;
import com.openonco.discovery.pipeline.util.KeywordTiers;
import com.openonco.discovery.pipeline.util.RelevanceClassifier;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vendor newsroom pages. Watches for new headlines that announce payer coverage.
 */
@Component
public class VendorNewsCrawler implements SourceCrawler {
    private static final Logger log = LoggerFactory.getLogger(VendorNewsCrawler.class);

    private static final String HEADLINE_SELECTOR = String.join(", ",
        "article h2", "article h3", ".news-item", ".press-release-title", "h2 a", "h3 a",
        "[class*=news] a", "[class*=press] a"
    );
    private static final int MIN_HEADLINE_LENGTH = 10;
    private static final int MAX_HEADLINE_LENGTH = 300;
    private static final int MAX_HEADLINES = 20;

    public static final KeywordTiers TIERS = KeywordTiers.of(
        List.of(
            "medicare", "cms", "medicaid", "unitedhealthcare", "uhc", "anthem", "cigna", "aetna",
            "humana", "blue cross", "bcbs", "national coverage", "lcd", "ncd"
        ),
        List.of("coverage", "reimbursement", "payer", "insurance", "prior authorization", "approved")
    );

    private static final String KEY_PREFIX = "vendor:";

    private final PipelineProperties properties;
    private final SourceHttpFetcher fetcher;
    private final PageChangeTracker changeTracker;

    public VendorNewsCrawler(PipelineProperties properties, SourceHttpFetcher fetcher, PageChangeTracker changeTracker) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.changeTracker = changeTracker;
    }

    @Override
    public String name() {
        return "Vendor Newsrooms";
    }

    @Override
    public DiscoverySource source() {
        return DiscoverySource.VENDOR;
    }

    @Override
    public double rateLimit() {
        return settings().getRateLimit();
    }

    @Override
    public boolean isEnabled() {
        return settings().isEnabled();
    }

    @Override
    public List<DiscoveryCandidate> crawl() {
        List<DiscoveryCandidate> discoveries = new ArrayList<>();
        int changed = 0;
        int failed = 0;
        for (PipelineProperties.VendorPage vendor : properties.getVendors()) {
            if (vendor.getNewsUrl() == null || vendor.getNewsUrl().isBlank()) {
                continue;
            }
            try {
                Document page = fetcher.fetchHtml(vendor.getNewsUrl(), settings().minIntervalMs());
                Map<String, String> headlines = extractHeadlines(page);
                String body = page.body() == null ? page.text() : page.body().text();
                PageChange change = changeTracker.observe(
                    KEY_PREFIX + vendor.getId(),
                    body,
                    new ArrayList<>(headlines.keySet())
                );
                if (!change.changed()) {
                    continue;
                }
                changed++;
                if (change.firstCapture()) {
                    log.info("Captured baseline for vendor {}", vendor.getName());
                    continue;
                }
                for (String headline : change.newItems()) {
                    DiscoveryCandidate discovery = createDiscovery(vendor, headline, headlines.get(headline));
                    if (discovery.relevance() != Relevance.LOW) {
                        discoveries.add(discovery);
                    }
                }
            } catch (SourceFetchException e) {
                failed++;
                log.warn("Vendor page failed for {}: {}", vendor.getName(), e.getMessage());
            }
        }
        log.info(
            "Vendor crawl checked {} pages: changed={}, failed={}, discoveries={}",
            properties.getVendors().size(),
            changed,
            failed,
            discoveries.size()
        );
        return discoveries;
    }

    /**
     * Headline text mapped to its absolute link (empty when the headline has none), in page order.
     */
    static Map<String, String> extractHeadlines(Document page) {
        Map<String, String> headlines = new LinkedHashMap<>();
        for (Element element : page.select(HEADLINE_SELECTOR)) {
            String text = element.text().trim().replaceAll("\\s+", " ");
            if (text.length() < MIN_HEADLINE_LENGTH || text.length() > MAX_HEADLINE_LENGTH || headlines.containsKey(text)) {
                continue;
            }
            headlines.put(text, linkOf(element));
            if (headlines.size() >= MAX_HEADLINES) {
                break;
            }
        }
        return headlines;
    }

    public DiscoveryCandidate createDiscovery(PipelineProperties.VendorPage vendor, String headline, String link) {
        String url = (link != null && link.startsWith("http"))
            ? link
            : vendor.getNewsUrl() + "#" + HashUtils.shortHash(headline);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("vendorId", vendor.getId());
        metadata.put("vendorName", vendor.getName());
        metadata.put("newsUrl", vendor.getNewsUrl());
        metadata.put("headline", headline);
        return new DiscoveryCandidate(
            DiscoverySource.VENDOR,
            "vendor_coverage_announcement",
            vendor.getName() + ": " + headline,
            "New announcement on " + vendor.getName() + " newsroom",
            url,
            RelevanceClassifier.classify(headline, TIERS),
            metadata
        );
    }

    private static String linkOf(Element element) {
        Element anchor = element.is("a[href]") ? element : element.selectFirst("a[href]");
        if (anchor == null) {
            anchor = element.closest("a[href]");
        }
        return anchor == null ? "" : anchor.absUrl("href");
    }

    @Override
    public void commitState() {
        changeTracker.commit(KEY_PREFIX);
    }

    @Override
    public void discardState() {
        changeTracker.discard(KEY_PREFIX);
    }

    private PipelineProperties.Crawler settings() {
        return properties.crawler(DiscoverySource.VENDOR);
    }
}
