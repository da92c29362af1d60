package com.delta.jobharvester.harvest.model;

import java.util.Locale;

public enum QualityTier {
    GOOD("good"),
    SO_SO("so-so"),
    BAD("bad"),
    ERROR("error");

    private final String wireValue;

    QualityTier(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean isQuality() {
        return this == GOOD || this == SO_SO;
    }

    public static QualityTier fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (QualityTier tier : values()) {
            if (tier.wireValue.equals(normalized) || tier.name().equalsIgnoreCase(normalized)) {
                return tier;
            }
        }
        return null;
    }
}
