package com.delta.jobharvester.harvest.model;

public record ItemClassification(
    int index,
    String itemId,
    ClassificationResult result
) {
}
