package com.delta.jobharvester.harvest.model;

import java.time.Instant;
import java.util.List;

public record RawPosting(
    String title,
    String company,
    String location,
    String description,
    String platform,
    List<String> sourceUrls,
    Instant scrapedAt
) {
    public RawPosting {
        sourceUrls = sourceUrls == null ? List.of() : List.copyOf(sourceUrls);
    }

    public String primarySourceUrl() {
        return sourceUrls.isEmpty() ? null : sourceUrls.get(0);
    }
}
