package com.delta.jobharvester.harvest.model;

/**
 * Final status of a harvested posting. Stored as {@link #label()}.
 */
public sealed interface PostingStatus
    permits PostingStatus.Included, PostingStatus.Filtered, PostingStatus.FromCache, PostingStatus.FreshlyClassified {

    String label();

    static PostingStatus forResult(ClassificationResult result) {
        if (result == null || result.provenance() == Provenance.ERROR_FALLBACK) {
            return new Included();
        }
        if (result.provenance() == Provenance.FROM_CACHE) {
            return new FromCache();
        }
        return new FreshlyClassified();
    }

    record Included() implements PostingStatus {
        @Override
        public String label() {
            return "included";
        }
    }

    record Filtered(String reason) implements PostingStatus {
        @Override
        public String label() {
            return "filtered: " + reason;
        }
    }

    record FromCache() implements PostingStatus {
        @Override
        public String label() {
            return "from_cache";
        }
    }

    record FreshlyClassified() implements PostingStatus {
        @Override
        public String label() {
            return "freshly_classified";
        }
    }
}
