package com.aurea.service.core.query.traffic;

import java.util.List;

/** Rates and averages carry two decimals. */
public record UtmAnalyticsResult(List<Row> analytics, Totals totals, String groupBy) {

    /**
     * Dimensions outside the grouping are null.
     *
     * @param revenuePerConversion revenue divided by conversions
     */
    public record Row(
            String source,
            String medium,
            String campaign,
            long sessions,
            long conversions,
            double conversionRate,
            double revenue,
            double avgPageViews,
            double avgRevenue,
            double revenuePerConversion) {}

    public record Totals(long totalSessions, long totalConversions, double totalRevenue, double avgConversionRate) {}
}
