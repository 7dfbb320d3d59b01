package com.openonco.discovery.pipeline.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.http.SourceFetchException;
import com.openonco.discovery.pipeline.http.SourceHttpFetcher;
import com.openonco.discovery.pipeline.model.DiscoveryCandidate;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.model.Relevance;
import com.openonco.discovery.pipeline.util.KeywordTiers;
import com.openonco.discovery.pipeline.util.RelevanceClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * medRxiv and bioRxiv listings for the past week, filtered to oncology and MRD topics.
 */
@Component
public class PreprintCrawler implements SourceCrawler {
    private static final Logger log = LoggerFactory.getLogger(PreprintCrawler.class);

    static final String DEFAULT_BASE_URL = "https://api.biorxiv.org/details";
    static final int PAGE_SIZE = 100;
    static final int MAX_CURSOR = 1000;
    private static final int LOOKBACK_DAYS = 7;
    private static final List<String> SERVERS = List.of("medrxiv", "biorxiv");

    static final List<String> ONCOLOGY_TERMS = List.of(
        "cancer", "tumor", "tumour", "oncology", "carcinoma", "neoplasm", "malignant",
        "metastasis", "metastatic", "ctdna", "liquid biopsy", "circulating tumor", "cell-free dna",
        "mrd", "minimal residual", "biopsy", "diagnostic", "biomarker", "methylation"
    );

    private static final KeywordTiers BASE_TIERS = KeywordTiers.of(
        List.of(
            "signatera", "guardant reveal", "guardant360", "foundationone", "foundationone cdx",
            "foundationone liquid", "tempus xt", "tempus xf", "galleri", "grail", "clonoseq",
            "minimal residual disease", "molecular residual disease", "mrd detection", "mrd monitoring",
            "mrd-guided", "clinical utility", "clinical validation", "validation study",
            "surveillance ctdna", "recurrence detection", "recurrence monitoring"
        ),
        List.of(
            "ctdna", "circulating tumor dna", "cell-free dna", "cfdna", "liquid biopsy", "cell-free tumor dna",
            "methylation cancer", "methylation detection", "methylation-based", "cancer methylation",
            "colorectal cancer", "colon cancer", "breast cancer", "lung cancer", "pancreatic cancer",
            "early detection cancer", "multi-cancer early detection", "mced",
            "tumor biomarker", "cancer biomarker", "circulating biomarker"
        )
    );

    private final PipelineProperties properties;
    private final SourceHttpFetcher fetcher;
    private final Clock clock;

    public PreprintCrawler(PipelineProperties properties, SourceHttpFetcher fetcher, Clock clock) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "medRxiv/bioRxiv";
    }

    @Override
    public DiscoverySource source() {
        return DiscoverySource.PREPRINT;
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
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        String interval = today.minusDays(LOOKBACK_DAYS) + "/" + today;
        KeywordTiers tiers = tiers();
        Set<String> seenDois = new HashSet<>();
        List<DiscoveryCandidate> discoveries = new ArrayList<>();

        for (String server : SERVERS) {
            for (JsonNode preprint : fetchServer(server, interval)) {
                String doi = CoverageRegistryCrawler.firstText(preprint, "doi");
                if (doi == null || !seenDois.add(doi)) {
                    continue;
                }
                DiscoveryCandidate discovery = createDiscovery(preprint, server, tiers);
                if (discovery != null && discovery.relevance() != Relevance.LOW) {
                    discoveries.add(discovery);
                }
            }
        }
        log.info("Preprint crawl saw {} unique DOIs, {} discoveries", seenDois.size(), discoveries.size());
        return discoveries;
    }

    /**
     * Pages through one server. A failed page ends paging for that server; the cursor never passes
     * {@link #MAX_CURSOR}.
     */
    List<JsonNode> fetchServer(String server, String interval) {
        String baseUrl = settings().baseUrlOr(DEFAULT_BASE_URL);
        List<String> monitored = monitoredLower();
        List<JsonNode> relevant = new ArrayList<>();
        int cursor = 0;
        while (true) {
            String url = baseUrl + "/" + server + "/" + interval + "/" + cursor;
            JsonNode page;
            try {
                page = fetcher.fetchJson(url, Map.of(), settings().minIntervalMs());
            } catch (SourceFetchException e) {
                log.warn("Preprint page failed for {} at cursor {}: {}", server, cursor, e.getMessage());
                break;
            }
            JsonNode collection = page.path("collection");
            if (!collection.isArray() || collection.isEmpty()) {
                break;
            }
            for (JsonNode preprint : collection) {
                if (isOncologyRelated(preprint, monitored)) {
                    relevant.add(preprint);
                }
            }
            if (collection.size() < PAGE_SIZE) {
                break;
            }
            cursor += PAGE_SIZE;
            if (cursor >= MAX_CURSOR) {
                log.warn("Reached cursor limit for {} at {}", server, cursor);
                break;
            }
        }
        return relevant;
    }

    public DiscoveryCandidate createDiscovery(JsonNode preprint, String server, KeywordTiers tiers) {
        String title = CoverageRegistryCrawler.firstText(preprint, "title");
        String doi = CoverageRegistryCrawler.firstText(preprint, "doi");
        if (title == null || doi == null) {
            return null;
        }
        String rawAuthors = orEmpty(CoverageRegistryCrawler.firstText(preprint, "authors"));
        String authors = formatAuthors(rawAuthors);
        String abstractText = orEmpty(CoverageRegistryCrawler.firstText(preprint, "abstract"));
        String pubDate = orEmpty(CoverageRegistryCrawler.firstText(preprint, "date", "published"));
        String version = CoverageRegistryCrawler.firstText(preprint, "version");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("doi", doi);
        metadata.put("authors", rawAuthors);
        metadata.put("authorFormatted", authors);
        metadata.put("server", server);
        metadata.put("category", orEmpty(CoverageRegistryCrawler.firstText(preprint, "category")));
        metadata.put("publishedDate", pubDate);
        metadata.put("abstract", abstractText);
        metadata.put("version", version == null ? "1" : version);
        metadata.put("license", orEmpty(CoverageRegistryCrawler.firstText(preprint, "license")));

        return new DiscoveryCandidate(
            DiscoverySource.PREPRINT,
            "preprint",
            title,
            authors + " - " + server + " (" + pubDate + ")",
            "https://doi.org/" + doi,
            RelevanceClassifier.classify(RelevanceClassifier.joinText(title, abstractText), tiers),
            metadata
        );
    }

    /**
     * Relevance tables with the monitored test names counted as high-tier terms.
     */
    public KeywordTiers tiers() {
        return BASE_TIERS.withExtraHigh(properties.getMonitoredTests());
    }

    static boolean isOncologyRelated(JsonNode preprint, List<String> monitoredLower) {
        String text = RelevanceClassifier.joinText(
            CoverageRegistryCrawler.firstText(preprint, "title"),
            CoverageRegistryCrawler.firstText(preprint, "abstract"),
            CoverageRegistryCrawler.firstText(preprint, "category")
        );
        return RelevanceClassifier.containsAny(text, ONCOLOGY_TERMS)
            || RelevanceClassifier.containsAny(text, monitoredLower);
    }

    static String formatAuthors(String authors) {
        List<String> names = Arrays.stream(authors.split(";"))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .toList();
        if (names.isEmpty()) {
            return "Unknown";
        }
        if (names.size() <= 3) {
            return String.join(", ", names);
        }
        return names.get(0) + " et al.";
    }

    private List<String> monitoredLower() {
        return KeywordTiers.of(properties.getMonitoredTests(), List.of()).high();
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private PipelineProperties.Crawler settings() {
        return properties.crawler(DiscoverySource.PREPRINT);
    }
}
