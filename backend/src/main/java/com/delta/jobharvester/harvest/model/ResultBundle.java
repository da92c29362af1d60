package com.delta.jobharvester.harvest.model;

import java.time.Instant;
import java.util.List;

public record ResultBundle(
    List<RawPosting> postings,
    Instant retrievedAt
) {
    public ResultBundle {
        postings = postings == null ? List.of() : List.copyOf(postings);
    }
}
