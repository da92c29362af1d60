package com.delta.jobharvester.harvest.model;

import java.time.Instant;

public record HarvestedPostingView(
    long taskId,
    int arrivalIndex,
    String fingerprint,
    String title,
    String company,
    String location,
    String market,
    String platform,
    String sourceUrl,
    String status,
    String qualityTier,
    String reason,
    String summary,
    String provenance,
    Instant scrapedAt
) {
}
