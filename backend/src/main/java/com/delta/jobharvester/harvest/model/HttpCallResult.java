package com.delta.jobharvester.harvest.model;

import java.time.Duration;
import java.time.Instant;

public record HttpCallResult(
    String requestedUrl,
    int statusCode,
    String body,
    String retryAfter,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }
}
