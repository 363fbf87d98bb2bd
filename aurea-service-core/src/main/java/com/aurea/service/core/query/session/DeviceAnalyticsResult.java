package com.aurea.service.core.query.session;

import java.util.List;

public record DeviceAnalyticsResult(
        List<Row> deviceTypes,
        List<Row> browsers,
        List<Row> operatingSystems,
        long totalSessions,
        long totalConversions) {

    /** Percentage and conversion rate carry one decimal. */
    public record Row(
            String name,
            long sessions,
            long conversions,
            double revenue,
            long pageViews,
            double percentage,
            double conversionRate) {}
}
