package com.delta.jobharvester.harvest.api;

public record TaskSubmitRequest(
    String owner,
    String kind,
    String searchTerms,
    String location,
    Integer limit,
    Boolean forceFreshClassification
) {
}
