package com.aurea.service.core.query.dashboard;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/** Analyses a dashboard request may include. */
public enum DashboardSection {
    OVERVIEW("overview"),
    TRAFFIC_SOURCES("traffic-sources"),
    UTM("utm"),
    ATTRIBUTION("attribution"),
    SESSIONS_TREND("sessions-trend"),
    EVENTS_TREND("events-trend"),
    DEVICES("devices"),
    GEOGRAPHY("geography"),
    PERFORMANCE("performance"),
    FUNNEL_FLOW("funnel-flow"),
    STAGE_FLOW("stage-flow"),
    CATEGORY_BREAKDOWN("category-breakdown"),
    TOP_MICRO_CONVERSIONS("top-micro-conversions"),
    ENGAGEMENT("engagement"),
    PURCHASE_HEATMAP("purchase-heatmap");

    private final String wireValue;

    DashboardSection(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static DashboardSection fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Dashboard section is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DashboardSection section : values()) {
            if (section.wireValue.equals(normalized) || section.name().equalsIgnoreCase(normalized)) {
                return section;
            }
        }
        throw new IllegalArgumentException("Unsupported dashboard section: " + value);
    }

    /** Every section when {@code values} is empty. */
    public static Set<DashboardSection> parse(Iterable<String> values) {
        EnumSet<DashboardSection> sections = EnumSet.noneOf(DashboardSection.class);
        if (values != null) {
            for (String value : values) {
                sections.add(fromValue(value));
            }
        }
        return sections.isEmpty() ? EnumSet.allOf(DashboardSection.class) : sections;
    }
}
