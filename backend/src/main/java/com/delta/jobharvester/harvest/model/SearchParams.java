package com.delta.jobharvester.harvest.model;

public record SearchParams(
    String searchTerms,
    String location,
    int limit,
    boolean forceFreshClassification
) {
    public String primaryTerm() {
        if (searchTerms == null) {
            return "";
        }
        String first = searchTerms.split(",")[0];
        return first.trim();
    }
}
