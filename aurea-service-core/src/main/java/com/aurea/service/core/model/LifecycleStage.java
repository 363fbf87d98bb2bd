package com.aurea.service.core.model;

import java.util.Locale;

public enum LifecycleStage {
    NEW,
    RETURNING,
    LOYAL,
    CHURNED;

    public static LifecycleStage fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LifecycleStage.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported lifecycle stage: " + value, ex);
        }
    }
}
