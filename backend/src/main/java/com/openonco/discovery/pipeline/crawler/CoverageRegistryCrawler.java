package com.openonco.discovery.pipeline.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.http.SourceFetchException;
import com.openonco.discovery.pipeline.http.SourceHttpFetcher;
import com.openonco.discovery.pipeline.model.DiscoveryCandidate;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.util.KeywordTiers;
import com.openonco.discovery.pipeline.util.ReasonCodeClassifier;
import com.openonco.discovery.pipeline.util.RelevanceClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Medicare Coverage Database: recent local articles plus keyword searches over final LCDs and NCDs.
 */
@Component
public class CoverageRegistryCrawler implements SourceCrawler {
    private static final Logger log = LoggerFactory.getLogger(CoverageRegistryCrawler.class);

    static final String DEFAULT_BASE_URL = "https://api.coverage.cms.gov";
    private static final String VIEW_BASE_URL = "https://www.cms.gov/medicare-coverage-database/view/";
    private static final Duration TOKEN_TTL = Duration.ofHours(1);

    static final List<String> SEARCH_KEYWORDS = List.of(
        "molecular",
        "liquid biopsy",
        "ctDNA",
        "MRD",
        "tumor marker",
        "genomic"
    );

    static final List<String> ONCOLOGY_KEYWORDS = List.of(
        "moldx",
        "molecular",
        "tumor",
        "cancer",
        "oncology",
        "biopsy",
        "genomic"
    );

    public static final KeywordTiers TIERS = KeywordTiers.of(
        List.of("moldx", "signatera", "guardant", "minimal residual disease", "mrd", "foundationone"),
        List.of("ctdna", "liquid biopsy", "circulating tumor", "genomic", "molecular diagnostic")
    );

    public enum DocumentType {
        LCD("LCD", "lcd.aspx?lcdid="),
        NCD("NCD", "ncd.aspx?ncdid="),
        ARTICLE("Article", "article.aspx?articleid=");

        private final String label;
        private final String viewPath;

        DocumentType(String label, String viewPath) {
            this.label = label;
            this.viewPath = viewPath;
        }

        public String label() {
            return label;
        }
    }

    private final PipelineProperties properties;
    private final SourceHttpFetcher fetcher;
    private final Clock clock;
    private final Object tokenLock = new Object();

    private String licenseToken;
    private Instant licenseTokenExpiresAt;

    public CoverageRegistryCrawler(PipelineProperties properties, SourceHttpFetcher fetcher, Clock clock) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "Medicare Coverage Database";
    }

    @Override
    public DiscoverySource source() {
        return DiscoverySource.COVERAGE_REGISTRY;
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
        String baseUrl = settings().baseUrlOr(DEFAULT_BASE_URL);
        Set<String> seen = new HashSet<>();
        List<DiscoveryCandidate> discoveries = new ArrayList<>();

        try {
            JsonNode response = authenticated(baseUrl + "/v1/reports/whats-new/local");
            collect(response, DocumentType.ARTICLE, seen, discoveries);
        } catch (SourceFetchException e) {
            log.warn("What's new report failed: {}", e.getMessage());
        }

        for (String keyword : SEARCH_KEYWORDS) {
            String encoded = URLEncoder.encode(keyword, StandardCharsets.UTF_8);
            try {
                JsonNode lcds = authenticated(baseUrl + "/v1/reports/local-coverage-final-lcds?keyword=" + encoded);
                collect(lcds, DocumentType.LCD, seen, discoveries);
            } catch (SourceFetchException e) {
                log.warn("LCD search failed for keyword '{}': {}", keyword, e.getMessage());
            }
            try {
                JsonNode ncds = authenticated(baseUrl + "/v1/reports/national-coverage-ncd?keyword=" + encoded);
                collect(ncds, DocumentType.NCD, seen, discoveries);
            } catch (SourceFetchException e) {
                log.warn("NCD search failed for keyword '{}': {}", keyword, e.getMessage());
            }
        }

        log.info("Coverage registry crawl found {} documents ({} seen)", discoveries.size(), seen.size());
        return discoveries;
    }

    /**
     * Maps one registry item. Returns null for items without a title.
     */
    public DiscoveryCandidate createDiscovery(JsonNode item, DocumentType documentType) {
        String title = firstText(item, "title", "name");
        if (title == null) {
            return null;
        }
        String id = firstText(item, "lcdId", "ncdId", "id", "articleId");
        String contractor = firstText(item, "contractor", "mac", "contractorName");
        String effectiveDate = firstText(item, "effectiveDate", "revisionEffectiveDate", "publishDate");
        Object version = version(item);

        List<String> summaryParts = new ArrayList<>();
        summaryParts.add(documentType.label() + " update");
        if (contractor != null) {
            summaryParts.add("Contractor: " + contractor);
        }
        if (effectiveDate != null) {
            summaryParts.add("Effective: " + effectiveDate);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("documentId", id == null ? "" : id);
        metadata.put("documentType", documentType.label());
        metadata.put("contractor", contractor == null ? "" : contractor);
        metadata.put("effectiveDate", effectiveDate == null ? "" : effectiveDate);
        metadata.put("version", version);

        String relevanceText = RelevanceClassifier.joinText(title, firstText(item, "summary", "description"));
        return new DiscoveryCandidate(
            DiscoverySource.COVERAGE_REGISTRY,
            "coverage_change",
            title,
            String.join(" | ", summaryParts),
            id == null ? null : VIEW_BASE_URL + documentType.viewPath + id,
            RelevanceClassifier.classify(relevanceText, TIERS),
            metadata
        );
    }

    /**
     * Within-run dedup key. Items without an id share the {@code unknown} id.
     */
    public static String documentKey(JsonNode item) {
        String id = firstText(item, "lcdId", "ncdId", "id", "articleId");
        return (id == null ? "unknown" : id) + ":" + version(item);
    }

    private void collect(JsonNode response, DocumentType type, Set<String> seen, List<DiscoveryCandidate> out) {
        JsonNode items = response == null ? null : response.path("data");
        if (items == null || !items.isArray()) {
            return;
        }
        for (JsonNode item : items) {
            String title = firstText(item, "title", "name");
            if (!RelevanceClassifier.containsAny(title, ONCOLOGY_KEYWORDS)) {
                continue;
            }
            if (!seen.add(documentKey(item))) {
                continue;
            }
            DiscoveryCandidate discovery = createDiscovery(item, type);
            if (discovery != null) {
                out.add(discovery);
            }
        }
    }

    private JsonNode authenticated(String url) {
        String token = licenseToken(settings().baseUrlOr(DEFAULT_BASE_URL));
        return fetcher.fetchJson(url, Map.of("Authorization", "Bearer " + token), settings().minIntervalMs());
    }

    private String licenseToken(String baseUrl) {
        synchronized (tokenLock) {
            Instant now = clock.instant();
            if (licenseToken != null && licenseTokenExpiresAt != null && now.isBefore(licenseTokenExpiresAt)) {
                return licenseToken;
            }
            String url = baseUrl + "/v1/metadata/license-agreement";
            JsonNode response = fetcher.fetchJson(url, Map.of(), settings().minIntervalMs());
            String token = response.path("data").path(0).path("Token").asText(null);
            if (token == null || token.isBlank()) {
                throw new SourceFetchException(ReasonCodeClassifier.PARSING_FAILED, url, "License agreement response carried no token");
            }
            licenseToken = token;
            licenseTokenExpiresAt = now.plus(TOKEN_TTL);
            return token;
        }
    }

    private PipelineProperties.Crawler settings() {
        return properties.crawler(DiscoverySource.COVERAGE_REGISTRY);
    }

    private static Object version(JsonNode item) {
        for (String field : List.of("version", "versionNumber")) {
            JsonNode node = item.path(field);
            if (node.isNumber() && node.asInt() != 0) {
                return node.asInt();
            }
            if (node.isTextual() && !node.asText().isBlank()) {
                String text = node.asText().trim();
                try {
                    return Integer.parseInt(text);
                } catch (NumberFormatException e) {
                    return text;
                }
            }
        }
        return 1;
    }

    static String firstText(JsonNode item, String... fields) {
        if (item == null) {
            return null;
        }
        for (String field : fields) {
            JsonNode node = item.get(field);
            if (node == null || node.isNull()) {
                continue;
            }
            String value = node.asText();
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
