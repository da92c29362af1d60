package com.delta.jobharvester.harvest.http;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.model.HttpCallResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Single-shot JSON transport for the scraping provider and the classifier.
 * Transport failures come back as error codes on the result; retries belong to the caller.
 */
@Service
public class ExternalHttpClient {
    private final HarvesterProperties properties;
    private final HttpClient client;

    public ExternalHttpClient(
        HarvesterProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpCallResult get(String url, Map<String, String> headers) {
        return executeOnce(url, "GET", null, headers);
    }

    public HttpCallResult postJson(String url, String jsonBody, Map<String, String> headers) {
        return executeOnce(url, "POST", jsonBody == null ? "" : jsonBody, headers);
    }

    private HttpCallResult executeOnce(String url, String method, String body, Map<String, String> headers) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", HarvesterProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", "application/json");
            if (headers != null) {
                headers.forEach((name, value) -> {
                    if (value != null) {
                        builder.header(name, value);
                    }
                });
            }
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new HttpCallResult(
                url,
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Retry-After").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private HttpCallResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpCallResult(
            url,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            return new URI(input.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
