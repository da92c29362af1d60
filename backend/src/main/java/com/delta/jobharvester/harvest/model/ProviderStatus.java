package com.delta.jobharvester.harvest.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ProviderStatus(
    ProviderState state,
    String rawStatus,
    String errorMessage,
    JsonNode data
) {
}
