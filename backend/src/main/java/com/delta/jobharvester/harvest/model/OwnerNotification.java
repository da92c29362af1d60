package com.delta.jobharvester.harvest.model;

import java.time.Instant;

public record OwnerNotification(
    long id,
    String owner,
    String message,
    NotificationType type,
    Long taskId,
    boolean read,
    Instant createdAt
) {
}
