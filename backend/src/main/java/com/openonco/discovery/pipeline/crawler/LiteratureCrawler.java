package com.openonco.discovery.pipeline.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * PubMed E-utilities: last week's publications mentioning monitored tests or MRD topics.
 */
@Component
public class LiteratureCrawler implements SourceCrawler {
    private static final Logger log = LoggerFactory.getLogger(LiteratureCrawler.class);

    static final String DEFAULT_BASE_URL = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
    private static final int MAX_TEST_QUERIES = 10;
    private static final int MAX_RESULTS_PER_QUERY = 20;
    private static final int LOOKBACK_DAYS = 7;

    static final List<String> TOPIC_QUERIES = List.of(
        "(ctDNA OR \"circulating tumor DNA\") AND \"minimal residual disease\"",
        "\"liquid biopsy\" AND (MRD OR \"molecular residual disease\")",
        "ctDNA AND colorectal AND (recurrence OR surveillance)",
        "\"clinical utility\" AND (ctDNA OR \"liquid biopsy\")",
        "\"validation study\" AND ctDNA AND cancer",
        "(Medicare OR \"coverage determination\") AND (ctDNA OR \"liquid biopsy\")"
    );

    public static final KeywordTiers TIERS = KeywordTiers.of(
        List.of(
            "signatera", "guardant reveal", "guardant360", "foundationone",
            "validation study", "clinical utility", "clinical validation", "comparative study",
            "medicare", "coverage",
            "mrd", "minimal residual disease", "molecular residual disease",
            "surveillance", "recurrence detection"
        ),
        List.of(
            "ctdna", "circulating tumor dna", "liquid biopsy", "colorectal", "colon cancer",
            "breast cancer", "lung cancer", "oncology", "biomarker"
        )
    );

    private static final Set<String> PROMOTED_ARTICLE_TYPES = Set.of("clinical trial", "review", "meta-analysis");

    private final PipelineProperties properties;
    private final SourceHttpFetcher fetcher;

    public LiteratureCrawler(PipelineProperties properties, SourceHttpFetcher fetcher) {
        this.properties = properties;
        this.fetcher = fetcher;
    }

    @Override
    public String name() {
        return "PubMed";
    }

    @Override
    public DiscoverySource source() {
        return DiscoverySource.LITERATURE;
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
        Set<String> seenPmids = new HashSet<>();
        List<DiscoveryCandidate> discoveries = new ArrayList<>();
        List<String> queries = queries();
        for (String query : queries) {
            try {
                for (JsonNode article : search(query)) {
                    String pmid = article.path("uid").asText("");
                    if (pmid.isBlank() || !seenPmids.add(pmid)) {
                        continue;
                    }
                    DiscoveryCandidate discovery = createDiscovery(pmid, article);
                    if (discovery != null && discovery.relevance() != Relevance.LOW) {
                        discoveries.add(discovery);
                    }
                }
            } catch (SourceFetchException e) {
                log.warn("PubMed query failed '{}': {}", query, e.getMessage());
            }
        }
        log.info("PubMed crawl ran {} queries, {} unique PMIDs, {} discoveries", queries.size(), seenPmids.size(), discoveries.size());
        return discoveries;
    }

    List<String> queries() {
        List<String> queries = new ArrayList<>();
        properties.getMonitoredTests().stream()
            .limit(MAX_TEST_QUERIES)
            .map(test -> "\"" + test + "\"")
            .forEach(queries::add);
        queries.addAll(TOPIC_QUERIES);
        return queries;
    }

    /**
     * Maps one esummary document. Returns null when the document has no title.
     */
    public DiscoveryCandidate createDiscovery(String pmid, JsonNode doc) {
        String title = CoverageRegistryCrawler.firstText(doc, "title");
        if (title == null) {
            return null;
        }
        String authors = formatAuthors(doc.path("authors"));
        String journal = orEmpty(CoverageRegistryCrawler.firstText(doc, "source", "fulljournalname"));
        String pubDate = orEmpty(CoverageRegistryCrawler.firstText(doc, "pubdate", "epubdate"));
        List<String> articleTypes = new ArrayList<>();
        doc.path("pubtype").forEach(type -> articleTypes.add(type.asText()));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("pmid", pmid);
        metadata.put("authors", authors);
        metadata.put("journal", journal);
        metadata.put("publicationDate", pubDate);
        metadata.put("articleType", articleTypes);
        metadata.put("doi", extractDoi(doc.path("articleids")));

        return new DiscoveryCandidate(
            DiscoverySource.LITERATURE,
            "publication",
            title,
            authors + " - " + journal + " (" + pubDate + ")",
            "https://pubmed.ncbi.nlm.nih.gov/" + pmid + "/",
            relevance(title, journal, articleTypes),
            metadata
        );
    }

    /**
     * Keyword tiers over title and journal. Clinical trials, reviews and meta-analyses that miss the
     * high tier are still promoted to high.
     */
    public static Relevance relevance(String title, String journal, List<String> articleTypes) {
        Relevance byText = RelevanceClassifier.classify(RelevanceClassifier.joinText(title, journal), TIERS);
        if (byText == Relevance.HIGH) {
            return byText;
        }
        for (String type : articleTypes) {
            if (type != null && PROMOTED_ARTICLE_TYPES.contains(type.toLowerCase(Locale.ROOT))) {
                return Relevance.HIGH;
            }
        }
        return byText;
    }

    static String formatAuthors(JsonNode authors) {
        if (authors == null || !authors.isArray() || authors.isEmpty()) {
            return "Unknown";
        }
        if (authors.size() <= 3) {
            List<String> names = new ArrayList<>();
            authors.forEach(author -> names.add(author.path("name").asText("")));
            return String.join(", ", names);
        }
        return authors.get(0).path("name").asText("") + " et al.";
    }

    private List<JsonNode> search(String query) {
        String baseUrl = settings().baseUrlOr(DEFAULT_BASE_URL);
        String searchUrl = baseUrl + "/esearch.fcgi?db=pubmed"
            + "&term=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
            + "&retmax=" + MAX_RESULTS_PER_QUERY
            + "&datetype=pdat&reldate=" + LOOKBACK_DAYS
            + "&retmode=json&sort=relevance";
        JsonNode searchResult = fetcher.fetchJson(searchUrl, Map.of(), settings().minIntervalMs());
        List<String> ids = new ArrayList<>();
        searchResult.path("esearchresult").path("idlist").forEach(id -> ids.add(id.asText()));
        if (ids.isEmpty()) {
            return List.of();
        }

        String summaryUrl = baseUrl + "/esummary.fcgi?db=pubmed&retmode=json&id="
            + URLEncoder.encode(String.join(",", ids), StandardCharsets.UTF_8);
        JsonNode result = fetcher.fetchJson(summaryUrl, Map.of(), settings().minIntervalMs()).path("result");
        List<JsonNode> articles = new ArrayList<>();
        for (String id : ids) {
            JsonNode doc = result.path(id);
            if (doc.isMissingNode() || doc.has("error")) {
                continue;
            }
            if (!doc.has("uid") && doc.isObject()) {
                ((ObjectNode) doc).put("uid", id);
            }
            articles.add(doc);
        }
        return articles;
    }

    private static String extractDoi(JsonNode articleIds) {
        for (JsonNode id : articleIds) {
            if ("doi".equals(id.path("idtype").asText())) {
                return id.path("value").asText(null);
            }
        }
        return null;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private PipelineProperties.Crawler settings() {
        return properties.crawler(DiscoverySource.LITERATURE);
    }
}
