package com.aurea.service.core.query.event;

import java.util.List;

public record PropertiesBreakdownResult(String eventName, long totalEvents, List<Property> properties) {

    /** @param totalValues values returned after the limit */
    public record Property(String propertyKey, long totalValues, List<Value> breakdown) {}

    public record Value(String value, long count, double revenue, double percentage) {}
}
