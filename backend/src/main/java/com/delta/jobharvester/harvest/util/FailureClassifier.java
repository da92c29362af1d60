package com.delta.jobharvester.harvest.util;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

public final class FailureClassifier {
  private FailureClassifier() {}

  public static FailureClass fromHttpStatus(int status) {
    if (status == 429) {
      return FailureClass.RATE_LIMITED;
    }
    if (status == 408 || status == 425 || (status >= 500 && status < 600)) {
      return FailureClass.TRANSIENT_NETWORK;
    }
    if (status >= 400 && status < 500) {
      return FailureClass.CLIENT_ERROR;
    }
    return FailureClass.PARSE_ERROR;
  }

  public static FailureClass fromErrorCode(String errorCode) {
    if (errorCode == null || errorCode.isBlank()) {
      return FailureClass.TRANSIENT_NETWORK;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout") || code.contains("io_error") || code.contains("http_error")) {
      return FailureClass.TRANSIENT_NETWORK;
    }
    return FailureClass.CLIENT_ERROR;
  }

  /** Accepts delta-seconds (integer or decimal) or an HTTP-date. */
  public static Optional<Duration> parseRetryAfter(String header, Instant now) {
    if (header == null || header.isBlank()) {
      return Optional.empty();
    }
    String value = header.trim();
    try {
      double seconds = Double.parseDouble(value);
      if (seconds < 0) {
        return Optional.empty();
      }
      return Optional.of(Duration.ofMillis((long) (seconds * 1000)));
    } catch (NumberFormatException ignored) {
      // fall through to HTTP-date
    }
    try {
      ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
      Duration wait = Duration.between(now, at.toInstant());
      return Optional.of(wait.isNegative() ? Duration.ZERO : wait);
    } catch (DateTimeParseException ignored) {
      return Optional.empty();
    }
  }
}
