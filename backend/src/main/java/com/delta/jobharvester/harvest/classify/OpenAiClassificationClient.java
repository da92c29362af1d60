package com.delta.jobharvester.harvest.classify;

import com.delta.jobharvester.config.HarvesterProperties;
import com.delta.jobharvester.harvest.http.ExternalHttpClient;
import com.delta.jobharvester.harvest.http.ExternalServiceException;
import com.delta.jobharvester.harvest.model.ClassificationItem;
import com.delta.jobharvester.harvest.model.ClassificationResult;
import com.delta.jobharvester.harvest.model.ClassificationTags;
import com.delta.jobharvester.harvest.model.HttpCallResult;
import com.delta.jobharvester.harvest.model.Provenance;
import com.delta.jobharvester.harvest.model.QualityTier;
import com.delta.jobharvester.harvest.util.FailureClass;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class OpenAiClassificationClient implements ClassificationClient {
    private static final String SERVICE = "classifier";
    private static final String PROMPT_RESOURCE = "classpath:prompts/classification-system.txt";
    private static final int MAX_REASON_CHARS = 120;
    private static final int MAX_SUMMARY_CHARS = 1000;
    private static final List<String> REQUIRED_FIELDS = List.of(
        "match", "reason", "summary", "route_type", "fair_chance", "career_pathway", "training_provided"
    );

    private final ExternalHttpClient httpClient;
    private final HarvesterProperties properties;
    private final ObjectMapper objectMapper;
    private final String systemPrompt;

    public OpenAiClassificationClient(
        ExternalHttpClient httpClient,
        HarvesterProperties properties,
        ObjectMapper objectMapper,
        ResourceLoader resourceLoader
    ) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.systemPrompt = loadPrompt(resourceLoader.getResource(PROMPT_RESOURCE));
    }

    @Override
    public ClassificationResult classify(ClassificationItem item) {
        HarvesterProperties.Classifier config = properties.getClassifier();
        if (config.getApiKey() == null) {
            throw new ExternalServiceException(FailureClass.CLIENT_ERROR, "classifier api key is not configured");
        }
        String url = trimTrailingSlash(config.getBaseUrl()) + "/v1/chat/completions";
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + config.getApiKey());
        HttpCallResult result = httpClient.postJson(url, requestBody(item), headers);
        if (!result.isSuccessful()) {
            throw ExternalServiceException.fromResult(SERVICE, result);
        }
        return parseResponse(result.body());
    }

    String requestBody(ClassificationItem item) {
        HarvesterProperties.Classifier config = properties.getClassifier();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", config.getModel());
        root.put("temperature", 0);
        root.put("max_tokens", config.getMaxTokens());
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userMessage(item));
        ObjectNode format = root.putObject("response_format");
        format.put("type", "json_schema");
        ObjectNode jsonSchema = format.putObject("json_schema");
        jsonSchema.put("name", "job_classification");
        jsonSchema.put("strict", true);
        jsonSchema.set("schema", responseSchema());
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException(FailureClass.CLIENT_ERROR, "could not serialize classifier request", e);
        }
    }

    ClassificationResult parseResponse(String body) {
        JsonNode content;
        try {
            JsonNode root = objectMapper.readTree(body == null ? "" : body);
            JsonNode message = root.path("choices").path(0).path("message");
            if (message.hasNonNull("refusal")) {
                throw new ExternalServiceException(FailureClass.PARSE_ERROR, "classifier refused: " + message.get("refusal").asText());
            }
            String text = message.path("content").asText("");
            if (text.isBlank()) {
                throw new ExternalServiceException(FailureClass.PARSE_ERROR, "classifier response had no content");
            }
            content = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException(FailureClass.PARSE_ERROR, "classifier response is not valid JSON", e);
        }
        for (String field : REQUIRED_FIELDS) {
            JsonNode value = content.get(field);
            if (value == null || value.isNull() || (value.isTextual() && value.asText().isBlank())) {
                throw new ExternalServiceException(FailureClass.PARSE_ERROR, "classifier response missing " + field);
            }
        }
        QualityTier tier = QualityTier.fromWire(content.get("match").asText());
        if (tier == null || tier == QualityTier.ERROR) {
            throw new ExternalServiceException(FailureClass.PARSE_ERROR, "unexpected match value " + content.get("match").asText());
        }
        ClassificationTags tags = new ClassificationTags(
            content.get("route_type").asText(),
            content.get("fair_chance").asText(),
            content.hasNonNull("endorsements") ? content.get("endorsements").asText() : null,
            content.get("career_pathway").asText(),
            content.get("training_provided").asBoolean()
        );
        return new ClassificationResult(
            tier,
            limit(content.get("reason").asText(), MAX_REASON_CHARS),
            limit(content.get("summary").asText(), MAX_SUMMARY_CHARS),
            tags,
            Provenance.FRESHLY_CLASSIFIED
        );
    }

    private String userMessage(ClassificationItem item) {
        return "Classify this job posting.\n"
            + "Title: " + item.title() + "\n"
            + "Company: " + item.company() + "\n"
            + "Location: " + item.location() + "\n"
            + "Description: " + item.description();
    }

    private ObjectNode responseSchema() {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        schema.put("additionalProperties", false);
        ObjectNode props = schema.putObject("properties");
        enumProperty(props, "match", List.of("good", "so-so", "bad"));
        props.putObject("reason").put("type", "string").put("maxLength", MAX_REASON_CHARS);
        props.putObject("summary").put("type", "string").put("maxLength", MAX_SUMMARY_CHARS);
        enumProperty(props, "route_type", List.of("Local", "Regional", "OTR", "Dedicated", "Unknown"));
        enumProperty(props, "fair_chance", List.of("fair_chance_employer", "background_check_required", "unknown"));
        props.putObject("endorsements").put("type", "string");
        enumProperty(props, "career_pathway", List.of("cdl_pathway", "dock_to_driver", "internal_cdl_training", "none"));
        props.putObject("training_provided").put("type", "boolean");
        ArrayNode required = schema.putArray("required");
        REQUIRED_FIELDS.forEach(required::add);
        required.add("endorsements");
        return schema;
    }

    private void enumProperty(ObjectNode props, String name, List<String> values) {
        ObjectNode node = props.putObject(name);
        node.put("type", "string");
        ArrayNode allowed = node.putArray("enum");
        values.forEach(allowed::add);
    }

    private String limit(String value, int max) {
        String trimmed = value.trim();
        return trimmed.length() > max ? trimmed.substring(0, max) : trimmed;
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String value = url.trim();
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static String loadPrompt(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Missing classification prompt " + PROMPT_RESOURCE, e);
        }
    }
}
