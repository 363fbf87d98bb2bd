package com.aurea.service.core.query.session;

import java.util.List;

/**
 * @param avgPageViews rounded mean page views per session
 * @param avgDuration rounded mean duration in seconds
 * @param avgExperienceScore rounded mean over sessions that carry a score
 */
public record SessionsTrendResult(
        List<Point> timeSeries,
        List<DurationBucket> durationDistribution,
        String interval,
        long totalSessions,
        long totalConversions,
        double totalRevenue,
        long avgPageViews,
        long avgDuration,
        long avgExperienceScore) {

    public record Point(
            String timestamp,
            String label,
            long sessions,
            long pageViews,
            long conversions,
            double revenue,
            long avgDuration,
            long avgExperienceScore) {}

    public record DurationBucket(String range, int minSeconds, Integer maxSeconds, long count) {}
}
