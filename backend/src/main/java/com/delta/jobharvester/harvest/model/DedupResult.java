package com.delta.jobharvester.harvest.model;

import java.util.List;

public record DedupResult(
    List<DedupDecision> decisions,
    int restoredCount
) {
    public DedupResult {
        decisions = List.copyOf(decisions);
    }

    public List<DedupDecision> survivors() {
        return decisions.stream().filter(DedupDecision::kept).toList();
    }

    public List<DedupDecision> collapsed() {
        return decisions.stream().filter(decision -> !decision.kept()).toList();
    }
}
