package com.delta.jobharvester.harvest.model;

import java.time.Instant;

public record CacheStats(
    long totalEntries,
    long freshEntries,
    Instant oldestClassifiedAt,
    Instant newestClassifiedAt,
    int ttlHours
) {
}
