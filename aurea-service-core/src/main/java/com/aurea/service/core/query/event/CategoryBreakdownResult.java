package com.aurea.service.core.query.event;

import java.util.List;

public record CategoryBreakdownResult(List<Category> categories, long totalEvents) {

    /**
     * @param avgValue mean micro-conversion value, one decimal
     * @param conversionRate converted sessions over sessions, two decimals
     */
    public record Category(
            String category,
            long count,
            double avgValue,
            long totalSessions,
            long convertedSessions,
            double conversionRate) {}
}
