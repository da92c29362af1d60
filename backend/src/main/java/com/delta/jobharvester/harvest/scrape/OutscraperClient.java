package com.delta.jobharvester.harvest.scrape;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.http.ExternalHttpClient;
import com.delta.jobharvester.harvest.http.ExternalServiceException;
import com.delta.jobharvester.harvest.http.RetryPolicy;
import com.delta.jobharvester.harvest.model.HttpCallResult;
import com.delta.jobharvester.harvest.model.ProviderState;
import com.delta.jobharvester.harvest.model.ProviderStatus;
import com.delta.jobharvester.harvest.model.SearchParams;
import com.delta.jobharvester.harvest.model.TaskKind;
import com.delta.jobharvester.harvest.util.FailureClass;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.Map;

@Service
public class OutscraperClient implements ScrapingProviderClient {
    private static final Logger log = LoggerFactory.getLogger(OutscraperClient.class);
    private static final String SERVICE = "scraper";

    private final ExternalHttpClient httpClient;
    private final HarvesterProperties properties;
    private final ObjectMapper objectMapper;
    private final RetryPolicy statusRetryPolicy;

    public OutscraperClient(ExternalHttpClient httpClient, HarvesterProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        int baseDelayMs = properties.getScraper().getPollRetryBaseDelayMs();
        this.statusRetryPolicy = RetryPolicy.forExternalCalls(
            properties.getScraper().getPollMaxAttempts(),
            Duration.ofMillis(baseDelayMs),
            Duration.ofMillis(Math.max(baseDelayMs, baseDelayMs * 4L))
        );
    }

    @Override
    public String submit(TaskKind kind, SearchParams params, String webhookUrl) {
        int limit = params.limit() > 0 ? params.limit() : properties.getScraper().getDefaultLimit();
        String query = kind == TaskKind.GOOGLE_JOBS
            ? (params.primaryTerm() + " " + nullToEmpty(params.location())).trim()
            : params.primaryTerm();
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl() + kind.submitPath())
            .queryParam("query", query)
            .queryParam("location", nullToEmpty(params.location()))
            .queryParam("limit", limit)
            .queryParam("async", "true");
        if (webhookUrl != null && !webhookUrl.isBlank()) {
            uri.queryParam("webhook", webhookUrl);
        }
        HttpCallResult result = httpClient.get(uri.encode().build().toUriString(), authHeaders());
        if (!result.isSuccessful()) {
            throw ExternalServiceException.fromResult(SERVICE, result);
        }
        JsonNode body = readJson(result.body());
        String requestId = firstText(body, "id", "request_id");
        if (requestId == null) {
            throw new ExternalServiceException(FailureClass.PARSE_ERROR, "scraper response had no request id");
        }
        log.info("Submitted {} scrape '{}' ({}), request id {}", kind, query, params.location(), requestId);
        return requestId;
    }

    @Override
    public ProviderStatus fetchStatus(String requestId) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl())
            .pathSegment("requests", requestId)
            .encode()
            .build()
            .toUriString();
        HttpCallResult result = statusRetryPolicy.execute("scraper status " + requestId, () -> {
            HttpCallResult call = httpClient.get(url, authHeaders());
            if (!call.isSuccessful()) {
                throw ExternalServiceException.fromResult(SERVICE, call);
            }
            return call;
        });
        JsonNode body = readJson(result.body());
        String rawStatus = firstText(body, "status");
        ProviderState state = ProviderState.fromProviderStatus(rawStatus);
        String error = state == ProviderState.ERROR
            ? firstTextOrDefault(body, "provider reported status " + rawStatus, "error", "message", "errorMessage")
            : null;
        return new ProviderStatus(state, rawStatus, error, body.path("data"));
    }

    private Map<String, String> authHeaders() {
        String apiKey = properties.getScraper().getApiKey();
        return apiKey == null ? Map.of() : Map.of("X-API-KEY", apiKey);
    }

    private String baseUrl() {
        String base = properties.getScraper().getBaseUrl();
        if (base == null || base.isBlank()) {
            throw new ExternalServiceException(FailureClass.CLIENT_ERROR, "scraper base url is not configured");
        }
        String value = base.trim();
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private JsonNode readJson(String body) {
        try {
            return objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException(FailureClass.PARSE_ERROR, "scraper response is not valid JSON", e);
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        return firstTextOrDefault(node, null, fields);
    }

    private static String firstTextOrDefault(JsonNode node, String fallback, String... fields) {
        if (node == null) {
            return fallback;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return fallback;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
