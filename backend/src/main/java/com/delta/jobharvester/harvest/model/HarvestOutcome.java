package com.delta.jobharvester.harvest.model;

public record HarvestOutcome(
    long taskId,
    Disposition disposition,
    int resultCount,
    int qualityJobCount,
    String message
) {
    public enum Disposition {
        PROCESSED,
        SKIPPED,
        FAILED
    }

    public static HarvestOutcome skipped(long taskId, String message) {
        return new HarvestOutcome(taskId, Disposition.SKIPPED, 0, 0, message);
    }

    public static HarvestOutcome failed(long taskId, String message) {
        return new HarvestOutcome(taskId, Disposition.FAILED, 0, 0, message);
    }
}
