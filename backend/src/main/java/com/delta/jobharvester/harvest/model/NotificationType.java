package com.delta.jobharvester.harvest.model;

public enum NotificationType {
    SEARCH_SUBMITTED,
    SEARCH_COMPLETE,
    ERROR
}
