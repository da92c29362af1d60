package com.delta.jobharvester.harvest.model;

public record ClassificationItem(
    String itemId,
    String title,
    String company,
    String location,
    String description
) {
}
