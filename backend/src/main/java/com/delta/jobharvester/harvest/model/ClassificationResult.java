package com.delta.jobharvester.harvest.model;

public record ClassificationResult(
    QualityTier tier,
    String reason,
    String summary,
    ClassificationTags tags,
    Provenance provenance
) {
    public static final String ERROR_SUMMARY = "Classification failed";

    public ClassificationResult {
        tags = tags == null ? ClassificationTags.unknown() : tags;
    }

    public static ClassificationResult errorFallback(String reason) {
        String safeReason = reason == null || reason.isBlank() ? "unknown error" : reason;
        return new ClassificationResult(QualityTier.ERROR, safeReason, ERROR_SUMMARY, ClassificationTags.unknown(), Provenance.ERROR_FALLBACK);
    }

    public boolean isComplete() {
        return tier != null
            && reason != null && !reason.isBlank()
            && summary != null && !summary.isBlank();
    }

    public boolean isCacheable() {
        return isComplete() && tier != QualityTier.ERROR;
    }

    public ClassificationResult withProvenance(Provenance next) {
        return new ClassificationResult(tier, reason, summary, tags, next);
    }
}
