package com.aurea.service.core.query.event;

import java.util.List;

public record EventsTrendResult(
        List<Point> timeSeries,
        List<EventType> eventTypes,
        String interval,
        long totalEvents,
        long totalConversions,
        double totalRevenue) {

    /** @param customEvents everything that is not a page view */
    public record Point(
            String timestamp,
            String label,
            long totalEvents,
            long pageViews,
            long customEvents,
            long conversions,
            double revenue) {}

    /** @param category category of the first occurrence seen, may be null */
    public record EventType(String eventName, long count, String category) {}
}
