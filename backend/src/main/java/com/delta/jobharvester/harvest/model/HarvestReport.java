package com.delta.jobharvester.harvest.model;

import java.util.List;

public record HarvestReport(
    List<HarvestedPosting> postings,
    int rawCount,
    int duplicateCount,
    int filteredCount,
    int cacheHitCount,
    int freshCount,
    int errorCount
) {
    public HarvestReport {
        postings = List.copyOf(postings);
    }

    public int qualityJobCount() {
        return (int) postings.stream().filter(HarvestedPosting::isQuality).count();
    }
}
