package com.delta.jobharvester.harvest.model;

import java.util.Locale;

public enum ProviderState {
    RUNNING,
    SUCCESS,
    ERROR;

    public static ProviderState fromProviderStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return RUNNING;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "success", "completed", "finished" -> SUCCESS;
            case "error", "failed", "failure" -> ERROR;
            default -> RUNNING;
        };
    }
}
