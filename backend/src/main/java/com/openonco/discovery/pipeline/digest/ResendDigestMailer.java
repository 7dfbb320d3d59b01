package com.openonco.discovery.pipeline.digest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openonco.discovery.config.PipelineProperties;
import com.openonco.discovery.pipeline.http.PoliteHttpClient;
import com.openonco.discovery.pipeline.model.DigestContent;
import com.openonco.discovery.pipeline.model.HttpFetchResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivers digests through the Resend HTTP API.
 */
@Component
public class ResendDigestMailer implements DigestMailer {
    private final PipelineProperties.Email email;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ResendDigestMailer(PipelineProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.email = properties.getEmail();
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String send(DigestContent content) {
        String apiKey = email.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new DeliveryException("Email API key is not configured");
        }
        List<String> recipients = email.getTo();
        if (recipients.isEmpty()) {
            throw new DeliveryException("No digest recipients configured");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", email.getFrom());
        payload.put("to", recipients);
        payload.put("subject", content.subject());
        payload.put("html", content.html());
        payload.put("text", content.text());

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Failed to encode email payload", e);
        }

        HttpFetchResult result = httpClient.postJson(email.getApiUrl(), body, Map.of("Authorization", "Bearer " + apiKey));
        if (!result.isSuccessful()) {
            String reason = result.errorCode() != null
                ? result.errorCode() + (result.errorMessage() == null ? "" : " " + result.errorMessage())
                : "HTTP " + result.statusCode() + (result.body() == null ? "" : " " + result.body());
            throw new DeliveryException("Email delivery failed: " + reason);
        }
        try {
            JsonNode response = objectMapper.readTree(result.body() == null ? "{}" : result.body());
            return response.path("id").asText(null);
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Unreadable email provider response", e);
        }
    }
}
