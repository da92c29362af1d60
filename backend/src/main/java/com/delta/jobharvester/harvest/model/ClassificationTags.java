package com.delta.jobharvester.harvest.model;

public record ClassificationTags(
    String routeType,
    String fairChance,
    String endorsements,
    String careerPathway,
    Boolean trainingProvided
) {
    public static ClassificationTags unknown() {
        return new ClassificationTags(null, null, null, null, null);
    }
}
