package com.aurea.service.core.query.event;

import java.util.List;

public record EventsOverTimeResult(long totalEvents, long totalConversions, String interval, List<Point> data) {

    public record Point(String timestamp, String date, long events, long conversions) {}
}
