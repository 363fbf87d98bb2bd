package com.aurea.service.core.flow;

import java.util.Locale;

/** Which events become flow nodes. */
public enum FlowEventFilter {
    PAGE_VIEW("page_view"),
    ALL("all");

    private final String wireValue;

    FlowEventFilter(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static FlowEventFilter fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PAGE_VIEW;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FlowEventFilter filter : values()) {
            if (filter.wireValue.equals(normalized)) {
                return filter;
            }
        }
        throw new IllegalArgumentException("Unsupported flow event type: " + value);
    }
}
