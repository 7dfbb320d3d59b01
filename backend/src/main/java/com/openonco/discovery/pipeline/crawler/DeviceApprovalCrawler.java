package com.openonco.discovery.pipeline.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.http.SourceFetchException;
import com.openonco.discovery.pipeline.http.SourceHttpFetcher;
import com.openonco.discovery.pipeline.model.DiscoveryCandidate;
import com.openonco.discovery.pipeline.model.DiscoverySource;
import com.openonco.discovery.pipeline.model.Relevance;
import com.openonco.discovery.pipeline.util.KeywordTiers;
import com.openonco.discovery.pipeline.util.ReasonCodeClassifier;
import com.openonco.discovery.pipeline.util.RelevanceClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * openFDA device endpoints: 510(k) clearances and PMA approvals decided in the last 30 days.
 */
@Component
public class DeviceApprovalCrawler implements SourceCrawler {
    private static final Logger log = LoggerFactory.getLogger(DeviceApprovalCrawler.class);

    static final String DEFAULT_BASE_URL = "https://api.fda.gov";
    private static final String PMN_VIEW_URL = "https://www.accessdata.fda.gov/scripts/cdrh/cfdocs/cfpmn/pmn.cfm?ID=";
    private static final String PMA_VIEW_URL = "https://www.accessdata.fda.gov/scripts/cdrh/cfdocs/cfpma/pma.cfm?id=";
    private static final int LOOKBACK_DAYS = 30;
    private static final int RESULT_LIMIT = 100;

    static final List<String> MONITORED_MANUFACTURERS = List.of(
        "natera", "guardant health", "foundation medicine", "tempus", "caris life sciences",
        "exact sciences", "grail", "freenome", "adaptive biotechnologies", "personalis"
    );

    static final List<String> RELEVANT_PRODUCT_CODES = List.of("MYZ", "PHI", "PIE", "PSZ", "QJY");

    static final List<String> SEARCH_KEYWORDS = List.of(
        "liquid biopsy", "circulating tumor dna", "ctdna", "minimal residual disease",
        "molecular residual disease", "next generation sequencing", "companion diagnostic", "pan-tumor"
    );

    public static final KeywordTiers TIERS = KeywordTiers.of(
        List.of(
            "natera", "guardant", "foundation medicine", "signatera", "guardant360", "ctdna",
            "liquid biopsy", "mrd", "minimal residual", "companion diagnostic"
        ),
        List.of("oncology", "cancer", "tumor", "neoplasm")
    );

    private final PipelineProperties properties;
    private final SourceHttpFetcher fetcher;
    private final Clock clock;

    public DeviceApprovalCrawler(PipelineProperties properties, SourceHttpFetcher fetcher, Clock clock) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "FDA Devices";
    }

    @Override
    public DiscoverySource source() {
        return DiscoverySource.DEVICE_APPROVAL;
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
        String range = "%5B" + today.minusDays(LOOKBACK_DAYS).format(DateTimeFormatter.BASIC_ISO_DATE)
            + "+TO+" + today.format(DateTimeFormatter.BASIC_ISO_DATE) + "%5D";
        String baseUrl = settings().baseUrlOr(DEFAULT_BASE_URL);
        Set<String> seen = new HashSet<>();
        List<DiscoveryCandidate> discoveries = new ArrayList<>();

        for (JsonNode device : query(baseUrl + "/device/510k.json?search=decision_date:" + range + "&limit=" + RESULT_LIMIT)) {
            String kNumber = CoverageRegistryCrawler.firstText(device, "k_number");
            if (kNumber == null || !seen.add(kNumber) || !isRelevant(device)) {
                continue;
            }
            addIfRelevant(discoveries, create510kDiscovery(device));
        }
        for (JsonNode device : query(baseUrl + "/device/pma.json?search=decision_date:" + range + "&limit=" + RESULT_LIMIT)) {
            String pmaNumber = CoverageRegistryCrawler.firstText(device, "pma_number");
            if (pmaNumber == null || !seen.add(pmaNumber) || !isRelevant(device)) {
                continue;
            }
            addIfRelevant(discoveries, createPmaDiscovery(device));
        }
        log.info("Device approval crawl checked {} decisions, {} discoveries", seen.size(), discoveries.size());
        return discoveries;
    }

    /**
     * A decision is worth classifying when it names a monitored manufacturer, a search keyword or a
     * molecular-diagnostics product code.
     */
    static boolean isRelevant(JsonNode device) {
        String text = device.toString();
        if (RelevanceClassifier.containsAny(text, MONITORED_MANUFACTURERS)
            || RelevanceClassifier.containsAny(text, SEARCH_KEYWORDS)) {
            return true;
        }
        String productCode = CoverageRegistryCrawler.firstText(device, "product_code");
        return productCode != null && RELEVANT_PRODUCT_CODES.contains(productCode);
    }

    public DiscoveryCandidate create510kDiscovery(JsonNode device) {
        String deviceName = CoverageRegistryCrawler.firstText(device, "device_name");
        if (deviceName == null) {
            deviceName = CoverageRegistryCrawler.firstText(device.path("openfda"), "device_name");
        }
        if (deviceName == null) {
            return null;
        }
        String kNumber = CoverageRegistryCrawler.firstText(device, "k_number");
        String applicant = CoverageRegistryCrawler.firstText(device, "applicant");
        String statement = CoverageRegistryCrawler.firstText(device, "statement_or_summary");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("kNumber", kNumber);
        metadata.put("deviceName", deviceName);
        metadata.put("applicant", applicant);
        metadata.put("decisionDate", CoverageRegistryCrawler.firstText(device, "decision_date"));
        metadata.put("productCode", CoverageRegistryCrawler.firstText(device, "product_code"));
        metadata.put("clearanceType", "510k");

        return new DiscoveryCandidate(
            DiscoverySource.DEVICE_APPROVAL,
            "fda_approval",
            "FDA 510(k) Cleared: " + deviceName,
            applicant + " - " + (statement == null ? "510(k) clearance" : statement),
            PMN_VIEW_URL + kNumber,
            RelevanceClassifier.classify(device.toString(), TIERS),
            metadata
        );
    }

    public DiscoveryCandidate createPmaDiscovery(JsonNode device) {
        String name = CoverageRegistryCrawler.firstText(device, "trade_name", "generic_name");
        if (name == null) {
            return null;
        }
        String pmaNumber = CoverageRegistryCrawler.firstText(device, "pma_number");
        String applicant = CoverageRegistryCrawler.firstText(device, "applicant");
        String statement = CoverageRegistryCrawler.firstText(device, "ao_statement");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("pmaNumber", pmaNumber);
        metadata.put("deviceName", name);
        metadata.put("applicant", applicant);
        metadata.put("decisionDate", CoverageRegistryCrawler.firstText(device, "decision_date"));
        metadata.put("productCode", CoverageRegistryCrawler.firstText(device, "product_code"));
        metadata.put("advisoryCommittee", CoverageRegistryCrawler.firstText(device, "advisory_committee"));
        metadata.put("clearanceType", "pma");

        return new DiscoveryCandidate(
            DiscoverySource.DEVICE_APPROVAL,
            "fda_approval",
            "FDA PMA Approved: " + name,
            applicant + " - " + (statement == null ? "PMA approval" : statement),
            PMA_VIEW_URL + pmaNumber,
            RelevanceClassifier.classify(device.toString(), TIERS),
            metadata
        );
    }

    private List<JsonNode> query(String url) {
        List<JsonNode> results = new ArrayList<>();
        try {
            fetcher.fetchJson(url, Map.of(), settings().minIntervalMs()).path("results").forEach(results::add);
        } catch (SourceFetchException e) {
            // openFDA answers 404 when nothing matched the date range
            if (ReasonCodeClassifier.HTTP_404.equals(e.getReasonCode())) {
                log.debug("No device decisions for {}", url);
            } else {
                log.warn("Device approval query failed: {}", e.getMessage());
            }
        }
        return results;
    }

    private void addIfRelevant(List<DiscoveryCandidate> discoveries, DiscoveryCandidate candidate) {
        if (candidate != null && candidate.relevance() != Relevance.LOW) {
            discoveries.add(candidate);
        }
    }

    private PipelineProperties.Crawler settings() {
        return properties.crawler(DiscoverySource.DEVICE_APPROVAL);
    }
}
