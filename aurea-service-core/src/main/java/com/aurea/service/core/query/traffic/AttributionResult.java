package com.aurea.service.core.query.traffic;

import com.aurea.service.core.attribution.AdPlatform;
import java.util.List;

public record AttributionResult(
        Summary summary,
        List<PlatformRow> platforms,
        List<CampaignRow> campaigns,
        List<ChannelSplit> firstTouch,
        List<ChannelSplit> lastTouch) {

    public record Summary(long totalConversions, double totalRevenue, double averageOrderValue) {}

    /**
     * @param platform conversion platform recorded on the session, {@code unknown} when absent
     * @param firstTouch conversions whose first touch carried a click id
     * @param lastTouch conversions whose last touch carried a click id
     */
    public record PlatformRow(
            String platform,
            long conversions,
            double revenue,
            long firstTouch,
            long lastTouch,
            double averageOrderValue) {}

    public record CampaignRow(String platform, String campaign, long conversions, double revenue) {}

    public record ChannelSplit(AdPlatform platform, String channel, long conversions, double revenue) {}
}
