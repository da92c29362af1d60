package com.delta.jobharvester.harvest.model;

public enum Provenance {
    FROM_CACHE,
    FRESHLY_CLASSIFIED,
    ERROR_FALLBACK
}
