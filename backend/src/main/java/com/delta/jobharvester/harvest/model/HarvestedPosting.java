package com.delta.jobharvester.harvest.model;

public record HarvestedPosting(
    DedupDecision decision,
    PostingStatus status,
    ClassificationResult classification
) {
    public boolean isQuality() {
        return classification != null
            && classification.tier() != null
            && classification.tier().isQuality()
            && !(status instanceof PostingStatus.Filtered);
    }
}
