package com.delta.jobharvester.harvest.http;

import com.delta.jobharvester.harvest.model.HttpCallResult;
import com.delta.jobharvester.harvest.util.FailureClass;
import com.delta.jobharvester.harvest.util.FailureClassifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public class ExternalServiceException extends RuntimeException {
    private final FailureClass failureClass;
    private final Integer statusCode;
    private final Duration retryAfter;

    public ExternalServiceException(FailureClass failureClass, String message) {
        this(failureClass, message, null, null, null);
    }

    public ExternalServiceException(FailureClass failureClass, String message, Throwable cause) {
        this(failureClass, message, null, null, cause);
    }

    public ExternalServiceException(
        FailureClass failureClass,
        String message,
        Integer statusCode,
        Duration retryAfter,
        Throwable cause
    ) {
        super(message, cause);
        this.failureClass = failureClass;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public static ExternalServiceException fromResult(String service, HttpCallResult result) {
        if (result.errorCode() != null) {
            return new ExternalServiceException(
                FailureClassifier.fromErrorCode(result.errorCode()),
                service + " " + result.errorCode() + ": " + result.errorMessage()
            );
        }
        Instant now = result.fetchedAt() == null ? Instant.now() : result.fetchedAt();
        return new ExternalServiceException(
            FailureClassifier.fromHttpStatus(result.statusCode()),
            service + " returned HTTP " + result.statusCode() + abbreviate(result.body()),
            result.statusCode(),
            FailureClassifier.parseRetryAfter(result.retryAfter(), now).orElse(null),
            null
        );
    }

    public FailureClass failureClass() {
        return failureClass;
    }

    public Integer statusCode() {
        return statusCode;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean isRetriable() {
        return failureClass != null && failureClass.isRetriable();
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > 200 ? trimmed.substring(0, 200) : trimmed);
    }
}
