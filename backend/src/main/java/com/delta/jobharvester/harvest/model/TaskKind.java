package com.delta.jobharvester.harvest.model;

import java.util.Locale;

public enum TaskKind {
    GOOGLE_JOBS("/google-search-jobs", "google"),
    INDEED_JOBS("/indeed-jobs", "indeed");

    private final String submitPath;
    private final String platform;

    TaskKind(String submitPath, String platform) {
        this.submitPath = submitPath;
        this.platform = platform;
    }

    public String submitPath() {
        return submitPath;
    }

    public String platform() {
        return platform;
    }

    public static TaskKind parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("GOOGLE")) {
            return GOOGLE_JOBS;
        }
        if (normalized.equals("INDEED")) {
            return INDEED_JOBS;
        }
        try {
            return TaskKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
