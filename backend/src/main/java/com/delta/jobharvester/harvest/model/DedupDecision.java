package com.delta.jobharvester.harvest.model;

public record DedupDecision(
    int index,
    RawPosting posting,
    Fingerprint fingerprint,
    String market,
    boolean kept,
    String collapseReason,
    Integer collapsedInto
) {
    public static DedupDecision kept(int index, RawPosting posting, Fingerprint fingerprint, String market) {
        return new DedupDecision(index, posting, fingerprint, market, true, null, null);
    }

    public DedupDecision collapse(String reason, int survivorIndex) {
        return new DedupDecision(index, posting, fingerprint, market, false, reason, survivorIndex);
    }

    public DedupDecision restore() {
        return new DedupDecision(index, posting, fingerprint, market, true, null, null);
    }

    public boolean hasMarket() {
        return market != null && !market.isBlank();
    }
}
