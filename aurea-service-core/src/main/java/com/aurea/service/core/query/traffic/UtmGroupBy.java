package com.aurea.service.core.query.traffic;

import java.util.Locale;

public enum UtmGroupBy {
    SOURCE,
    MEDIUM,
    CAMPAIGN,
    ALL;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static UtmGroupBy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SOURCE;
        }
        try {
            return UtmGroupBy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported UTM grouping: " + value, ex);
        }
    }
}
