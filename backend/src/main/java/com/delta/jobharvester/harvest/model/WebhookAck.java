package com.delta.jobharvester.harvest.model;

public record WebhookAck(
    String status,
    String message,
    String requestId,
    Long taskId
) {
}
