package com.aurea.service.core.bucket;

import java.util.Locale;

/** How a time series treats buckets of the window that received no rows. */
public enum SeriesFill {
    /** Only populated buckets are returned. */
    NONE("none"),
    /** Every bucket between the window bounds is returned, empty ones zeroed. */
    ZERO("zero");

    private final String wireValue;

    SeriesFill(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static SeriesFill fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SeriesFill fill : values()) {
            if (fill.wireValue.equals(normalized)) {
                return fill;
            }
        }
        throw new IllegalArgumentException("Unsupported series fill: " + value);
    }
}
