package com.openonco.discovery.pipeline.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openonco.discovery.config.PipelineConfig;
import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.http.PoliteHttpClient;
import com.openonco.discovery.pipeline.http.SourceHttpFetcher;
import com.openonco.discovery.pipeline.model.DiscoveryCandidate;
import com.openonco.discovery.pipeline.model.Relevance;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PreprintCrawlerTest {
    private final ObjectMapper objectMapper = new PipelineConfig().objectMapper();
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void pagingStopsAtTheCursorCapForEachServer() throws Exception {
        AtomicInteger counter = new AtomicInteger();
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return json(fullPage(counter.incrementAndGet()));
            }
        });
        server.start();

        PreprintCrawler crawler = crawler();
        List<DiscoveryCandidate> discoveries = crawler.crawl();

        assertThat(server.getRequestCount()).isEqualTo(20);
        assertThat(discoveries).hasSize(2000);
        assertThat(discoveries).allMatch(discovery -> discovery.relevance() != Relevance.LOW);
        RecordedRequest first = server.takeRequest();
        assertThat(first.getPath()).isEqualTo("/medrxiv/2026-02-23/2026-03-02/0");
    }

    @Test
    void shortPageEndsPagingAndFailedServerIsSkipped() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if (request.getPath().startsWith("/biorxiv")) {
                    return new MockResponse().setResponseCode(404);
                }
                return json("{\"collection\":[" + preprint("10.1101/short.1", "Signatera MRD surveillance in colorectal cancer")
                    + "," + preprint("10.1101/short.2", "Sleep quality in shift workers") + "]}");
            }
        });
        server.start();

        List<DiscoveryCandidate> discoveries = crawler().crawl();

        assertThat(discoveries).hasSize(1);
        DiscoveryCandidate discovery = discoveries.get(0);
        assertThat(discovery.url()).isEqualTo("https://doi.org/10.1101/short.1");
        assertThat(discovery.relevance()).isEqualTo(Relevance.HIGH);
        assertThat(discovery.metadata()).containsEntry("server", "medrxiv").containsEntry("doi", "10.1101/short.1");
        assertThat(discovery.summary()).isEqualTo("Smith J, Doe A - medrxiv (2026-03-01)");
    }

    @Test
    void monitoredTestNamesCountAsHighTier() throws Exception {
        PipelineProperties properties = new PipelineProperties();
        properties.setMonitoredTests(List.of("Haystack MRD"));
        PreprintCrawler crawler = new PreprintCrawler(properties, null, Clock.systemUTC());
        JsonNode preprint = objectMapper.readTree(preprint("10.1101/x", "Haystack MRD performance in plasma"));

        DiscoveryCandidate discovery = crawler.createDiscovery(preprint, "biorxiv", crawler.tiers());

        assertThat(discovery.relevance()).isEqualTo(Relevance.HIGH);
        assertThat(PreprintCrawler.formatAuthors("A; B; C; D")).isEqualTo("A et al.");
        assertThat(PreprintCrawler.formatAuthors("")).isEqualTo("Unknown");
    }

    private PreprintCrawler crawler() {
        PipelineProperties properties = new PipelineProperties();
        properties.getHttp().setRequestMaxRetries(0);
        properties.getHttp().setRequestTimeoutSeconds(5);
        PipelineProperties.Crawler settings = new PipelineProperties.Crawler();
        settings.setRateLimit(1000);
        settings.setBaseUrl(server.url("/").toString());
        properties.setCrawlers(Map.of("preprint", settings));

        executor = Executors.newFixedThreadPool(2);
        SourceHttpFetcher fetcher = new SourceHttpFetcher(new PoliteHttpClient(properties, executor), objectMapper);
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T12:00:00Z"), ZoneOffset.UTC);
        return new PreprintCrawler(properties, fetcher, clock);
    }

    private static MockResponse json(String body) {
        return new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json").setBody(body);
    }

    private static String fullPage(int page) {
        StringBuilder body = new StringBuilder("{\"collection\":[");
        for (int i = 0; i < 100; i++) {
            if (i > 0) {
                body.append(',');
            }
            body.append(preprint("10.1101/p" + page + "." + i, "ctDNA minimal residual disease detection " + page + "-" + i));
        }
        return body.append("]}").toString();
    }

    private static String preprint(String doi, String title) {
        return "{\"doi\":\"" + doi + "\",\"title\":\"" + title + "\",\"authors\":\"Smith J; Doe A\","
            + "\"date\":\"2026-03-01\",\"category\":\"oncology\",\"abstract\":\"\",\"version\":\"1\"}";
    }
}
