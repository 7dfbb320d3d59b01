package com.openonco.discovery.pipeline.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openonco.discovery.pipeline.model.HttpFetchResult;
import com.openonco.discovery.pipeline.util.ReasonCodeClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Fetches source payloads through {@link PoliteHttpClient} and turns unsuccessful results into
 * {@link SourceFetchException}s so crawlers can skip the failed request and carry on.
 */
@Component
public class SourceHttpFetcher {
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SourceHttpFetcher(PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public JsonNode fetchJson(String url, Map<String, String> headers, long minIntervalMs) {
        HttpFetchResult result = httpClient.get(url, "application/json", headers, minIntervalMs);
        String body = requireBody(url, result);
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(ReasonCodeClassifier.PARSING_FAILED, url, "Invalid JSON from " + url, e);
        }
    }

    public Document fetchHtml(String url, long minIntervalMs) {
        HttpFetchResult result = httpClient.get(
            url,
            "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8",
            Map.of(),
            minIntervalMs
        );
        String body = requireBody(url, result);
        return Jsoup.parse(body, result.finalUrlOrRequested());
    }

    private String requireBody(String url, HttpFetchResult result) {
        if (result.errorCode() != null) {
            throw new SourceFetchException(
                ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage()),
                url,
                "Request to " + url + " failed: " + result.errorCode()
                    + (result.errorMessage() == null ? "" : " (" + result.errorMessage() + ")")
            );
        }
        if (!result.isSuccessful()) {
            throw new SourceFetchException(
                ReasonCodeClassifier.fromHttpStatus(result.statusCode()),
                url,
                "Request to " + url + " returned HTTP " + result.statusCode()
            );
        }
        if (result.body() == null || result.body().isBlank()) {
            throw new SourceFetchException(ReasonCodeClassifier.PARSING_FAILED, url, "Empty response from " + url);
        }
        return result.body();
    }
}
