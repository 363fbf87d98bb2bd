package com.aurea.service.core.model;

import java.util.Locale;

/** Rating a browser assigns to one web-vital measurement against the metric's thresholds. */
public enum VitalRating {
    GOOD,
    NEEDS_IMPROVEMENT,
    POOR;

    /** Null for absent or unrecognised ratings; stored rows are read leniently. */
    public static VitalRating fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (VitalRating rating : values()) {
            if (rating.name().equals(normalized)) {
                return rating;
            }
        }
        return null;
    }
}
