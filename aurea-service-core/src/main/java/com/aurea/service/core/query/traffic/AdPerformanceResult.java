package com.aurea.service.core.query.traffic;

import java.util.List;
import java.util.Map;

/** Converted sessions of the window broken down by the ad platform that recorded the conversion. */
public record AdPerformanceResult(
        AttributionResult.Summary summary, List<PlatformRow> platforms, List<TimelinePoint> timeline) {

    /**
     * @param firstTouch conversions whose first touch carried any click id
     * @param lastTouch conversions whose last touch carried any click id
     * @param topCampaigns campaigns of this platform by revenue, at most five
     */
    public record PlatformRow(
            String platform,
            long conversions,
            double revenue,
            long firstTouch,
            long lastTouch,
            double averageOrderValue,
            List<CampaignRow> topCampaigns) {}

    public record CampaignRow(String campaign, long conversions, double revenue) {}

    /**
     * @param date calendar day of the session start, {@code yyyy-MM-dd}
     * @param platforms conversions per platform; every platform of the window appears on every day
     */
    public record TimelinePoint(String date, long total, Map<String, Long> platforms) {}
}
