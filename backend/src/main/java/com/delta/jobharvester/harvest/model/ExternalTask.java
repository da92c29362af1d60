package com.delta.jobharvester.harvest.model;

import java.time.Instant;

public record ExternalTask(
    long id,
    String requestId,
    String owner,
    TaskKind kind,
    TaskState state,
    SearchParams searchParams,
    Instant submittedAt,
    Instant completedAt,
    int resultCount,
    int qualityJobCount,
    String errorMessage,
    Instant createdAt
) {
    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }

    public String describeSearch() {
        if (searchParams == null) {
            return "search";
        }
        return searchParams.primaryTerm() + " in " + searchParams.location();
    }
}
