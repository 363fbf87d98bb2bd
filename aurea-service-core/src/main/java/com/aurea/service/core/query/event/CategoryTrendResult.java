package com.aurea.service.core.query.event;

import java.util.List;
import java.util.Map;

/**
 * Every point carries a count for every category in {@code categories}.
 *
 * @param categories sorted alphabetically
 */
public record CategoryTrendResult(long totalEvents, String interval, List<Point> data, List<String> categories) {

    public record Point(String timestamp, String date, Map<String, Long> counts) {}
}
