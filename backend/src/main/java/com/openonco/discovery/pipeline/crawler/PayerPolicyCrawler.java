package com.openonco.discovery.pipeline.crawler;

import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.http.SourceFetchException;
import com.openonco.discovery.pipeline.http.SourceHttpFetcher;
import com.openonco.discovery.pipeline.model.DiscoveryCandidate;
import com.openonco.discovery.pipeline.model.DiscoverySource;
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
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Payer medical-policy index pages. New molecular or oncology policy links become discoveries; a
 * changed index without new links becomes a single update discovery.
 */
@Component
public class PayerPolicyCrawler implements SourceCrawler {
    private static final Logger log = LoggerFactory.getLogger(PayerPolicyCrawler.class);

    static final List<String> SEARCH_TERMS = List.of(
        "molecular", "genetic", "oncology", "tumor", "genomic", "liquid biopsy", "ctdna", "ngs"
    );
    private static final List<String> POLICY_HREF_MARKERS = List.of("policy", "bulletin", "coverage", "cpb", ".pdf");
    private static final Pattern POLICY_ID = Pattern.compile(
        "(?:policy|bulletin|cpb|document)[_\\-]?(?:id)?[=/]?(\\d+)",
        Pattern.CASE_INSENSITIVE
    );
    private static final int MIN_LINK_TEXT_LENGTH = 6;

    public static final KeywordTiers TIERS = KeywordTiers.of(
        List.of(
            "mrd", "ctdna", "liquid biopsy", "circulating tumor", "signatera", "guardant",
            "foundationone", "minimal residual", "galleri"
        ),
        List.of(
            "molecular", "genomic", "genetic testing", "oncology", "tumor marker", "ngs",
            "next-generation", "comprehensive genomic"
        )
    );

    private static final String KEY_PREFIX = "payer:";

    private final PipelineProperties properties;
    private final SourceHttpFetcher fetcher;
    private final PageChangeTracker changeTracker;

    public PayerPolicyCrawler(PipelineProperties properties, SourceHttpFetcher fetcher, PageChangeTracker changeTracker) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.changeTracker = changeTracker;
    }

    @Override
    public String name() {
        return "Payer Policies";
    }

    @Override
    public DiscoverySource source() {
        return DiscoverySource.PAYER;
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
        for (PipelineProperties.PayerPage payer : properties.getPayers()) {
            if (payer.getIndexUrl() == null || payer.getIndexUrl().isBlank()) {
                continue;
            }
            try {
                Document page = fetcher.fetchHtml(payer.getIndexUrl(), settings().minIntervalMs());
                Map<String, String> links = extractPolicyLinks(page);
                String body = page.body() == null ? page.text() : page.body().text();
                PageChange change = changeTracker.observe(KEY_PREFIX + payer.getId(), body, new ArrayList<>(links.keySet()));
                if (!change.changed()) {
                    continue;
                }
                if (change.firstCapture()) {
                    log.info("Captured baseline for payer {}", payer.getName());
                    continue;
                }
                if (change.newItems().isEmpty()) {
                    discoveries.add(createIndexUpdateDiscovery(payer, change.hash()));
                    continue;
                }
                for (String href : change.newItems()) {
                    discoveries.add(createPolicyLinkDiscovery(payer, links.get(href), href));
                }
            } catch (SourceFetchException e) {
                log.warn("Payer index failed for {}: {}", payer.getName(), e.getMessage());
            }
        }
        log.info("Payer crawl checked {} index pages, {} discoveries", properties.getPayers().size(), discoveries.size());
        return discoveries;
    }

    /**
     * Absolute policy hrefs mapped to their link text, limited to links that mention a search term.
     */
    static Map<String, String> extractPolicyLinks(Document page) {
        Map<String, String> links = new LinkedHashMap<>();
        for (Element anchor : page.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.isBlank()) {
                href = anchor.attr("href");
            }
            String text = anchor.text().trim();
            String lowerHref = href.toLowerCase(Locale.ROOT);
            if (text.length() < MIN_LINK_TEXT_LENGTH || POLICY_HREF_MARKERS.stream().noneMatch(lowerHref::contains)) {
                continue;
            }
            if (!RelevanceClassifier.containsAny(text + " " + href, SEARCH_TERMS)) {
                continue;
            }
            links.putIfAbsent(href, text);
        }
        return links;
    }

    public DiscoveryCandidate createPolicyLinkDiscovery(PipelineProperties.PayerPage payer, String text, String href) {
        String linkText = text == null ? href : text;
        String matchText = linkText + " " + href;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("payer", payer.getName());
        metadata.put("payerId", payer.getId());
        metadata.put("policyId", policyId(href));
        metadata.put("policyTitle", linkText);
        metadata.put("changeType", "new");
        metadata.put("matchedKeywords", RelevanceClassifier.matching(matchText, SEARCH_TERMS));
        return new DiscoveryCandidate(
            DiscoverySource.PAYER,
            "payer_policy_new",
            payer.getName() + ": " + linkText,
            payer.getName() + " policy published",
            href,
            RelevanceClassifier.classify(matchText, TIERS),
            metadata
        );
    }

    DiscoveryCandidate createIndexUpdateDiscovery(PipelineProperties.PayerPage payer, String hash) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("payer", payer.getName());
        metadata.put("payerId", payer.getId());
        metadata.put("policyId", null);
        metadata.put("policyTitle", "Policy index");
        metadata.put("changeType", "revision");
        metadata.put("matchedKeywords", List.of());
        return new DiscoveryCandidate(
            DiscoverySource.PAYER,
            "payer_policy_update",
            payer.getName() + ": Policy index updated",
            payer.getName() + " policy index content changed",
            payer.getIndexUrl() + "#" + hash.substring(0, Math.min(12, hash.length())),
            RelevanceClassifier.classify(payer.getName(), TIERS),
            metadata
        );
    }

    static String policyId(String href) {
        if (href == null) {
            return null;
        }
        Matcher matcher = POLICY_ID.matcher(href);
        return matcher.find() ? matcher.group(1) : null;
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
        return properties.crawler(DiscoverySource.PAYER);
    }
}
