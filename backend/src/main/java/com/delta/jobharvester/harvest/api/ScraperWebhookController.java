package com.delta.jobharvester.harvest.api;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.model.WebhookAck;
import com.delta.jobharvester.harvest.service.TaskOrchestratorService;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@RestController
@RequestMapping("/api/webhooks")
public class ScraperWebhookController {
    private static final Logger log = LoggerFactory.getLogger(ScraperWebhookController.class);
    static final String SECRET_HEADER = "X-Webhook-Secret";

    private final TaskOrchestratorService orchestrator;
    private final HarvesterProperties properties;

    public ScraperWebhookController(TaskOrchestratorService orchestrator, HarvesterProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @PostMapping("/scraper")
    public ResponseEntity<WebhookAck> scraperCompleted(
        @RequestHeader(name = SECRET_HEADER, required = false) String headerSecret,
        @RequestParam(name = "secret", required = false) String querySecret,
        @RequestBody(required = false) JsonNode payload
    ) {
        String expected = properties.getScraper().getWebhookSecret();
        if (expected != null) {
            String provided = headerSecret != null ? headerSecret : querySecret;
            if (!secretMatches(expected, provided)) {
                log.warn("Rejected scraper webhook with missing or wrong secret");
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(new WebhookAck("unauthorized", "invalid webhook secret", null, null));
            }
        }
        String requestId = textField(payload, "id", "request_id");
        if (requestId == null) {
            return ResponseEntity.badRequest()
                .body(new WebhookAck("invalid", "payload has no request id", null, null));
        }
        String status = textField(payload, "status");
        JsonNode data = payload.get("data");
        log.info("Scraper webhook for request {} with status {}", requestId, status);
        return ResponseEntity.ok(orchestrator.handleWebhook(requestId, status, data));
    }

    private boolean secretMatches(String expected, String provided) {
        if (provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            provided.getBytes(StandardCharsets.UTF_8)
        );
    }

    private String textField(JsonNode payload, String... names) {
        if (payload == null || !payload.isObject()) {
            return null;
        }
        for (String name : names) {
            JsonNode value = payload.get(name);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
