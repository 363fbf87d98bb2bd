package com.aurea.service.core.query.traffic;

import java.util.List;

public record OverviewResult(Stats stats, List<UtmCombination> trafficSources) {

    /**
     * @param totalRevenue revenue of conversion events
     * @param avgSessionDurationMillis mean length of ended sessions in milliseconds
     */
    public record Stats(
            long totalEvents,
            long totalSessions,
            long totalPageViews,
            long totalConversions,
            double totalRevenue,
            double avgSessionDurationMillis) {}

    /** Event UTM triple; a null source means direct traffic. */
    public record UtmCombination(String utmSource, String utmMedium, String utmCampaign, long count) {}
}
