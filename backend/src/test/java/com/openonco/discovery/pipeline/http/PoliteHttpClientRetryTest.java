package com.openonco.discovery.pipeline.http;

import com.openonco.discovery.config.PipelineConfig;
import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.model.HttpFetchResult;
import com.openonco.discovery.pipeline.util.ReasonCodeClassifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        PipelineProperties properties = new PipelineProperties();
        properties.getHttp().setDefaultHostDelayMs(1);
        properties.getHttp().setRequestTimeoutSeconds(5);
        properties.getHttp().setRequestMaxRetries(2);
        properties.getHttp().setRequestRetryBaseDelayMs(1);
        properties.getHttp().setRequestRetryMaxDelayMs(5);
        properties.getHttp().setUserAgent("openonco-test/1.0");

        executor = Executors.newFixedThreadPool(1);
        client = new PoliteHttpClient(properties, executor);
    }

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
    void retriesServerErrorsUntilSuccess() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(502));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"ok\":true}"));

        HttpFetchResult result = client.get(server.url("/retry").toString(), "application/json");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("{\"ok\":true}");
        assertThat(server.getRequestCount()).isEqualTo(3);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("User-Agent")).isEqualTo("openonco-test/1.0");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    void clientErrorsAreNotRetried() {
        server.enqueue(new MockResponse().setResponseCode(404));

        HttpFetchResult result = client.get(server.url("/missing").toString(), "text/html");

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.isSuccessful()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void exhaustedRetriesReturnLastResponse() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }

        HttpFetchResult result = client.get(server.url("/down").toString(), "text/html");

        assertThat(result.statusCode()).isEqualTo(500);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void malformedUrlIsReportedWithoutARequest() {
        HttpFetchResult result = client.get("https://", "text/html");
        assertThat(result.errorCode()).isEqualTo("invalid_url");
    }

    @Test
    void postJsonSendsBodyAndHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"id\":\"m1\"}"));

        HttpFetchResult result = client.postJson(server.url("/emails").toString(), "{\"a\":1}", Map.of("Authorization", "Bearer k"));

        assertThat(result.isSuccessful()).isTrue();
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer k");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"a\":1}");
    }

    @Test
    void fetcherTurnsHttpFailuresIntoReasonCodes() {
        server.enqueue(new MockResponse().setResponseCode(404));
        SourceHttpFetcher fetcher = new SourceHttpFetcher(client, new PipelineConfig().objectMapper());

        assertThatThrownBy(() -> fetcher.fetchJson(server.url("/gone").toString(), Map.of(), 1))
            .isInstanceOf(SourceFetchException.class)
            .satisfies(error -> assertThat(((SourceFetchException) error).getReasonCode())
                .isEqualTo(ReasonCodeClassifier.HTTP_404));
    }

    @Test
    void fetcherRejectsInvalidJson() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>not json</html>"));
        SourceHttpFetcher fetcher = new SourceHttpFetcher(client, new PipelineConfig().objectMapper());

        assertThatThrownBy(() -> fetcher.fetchJson(server.url("/html").toString(), Map.of(), 1))
            .isInstanceOf(SourceFetchException.class)
            .hasMessageContaining("Invalid JSON");
    }
}
