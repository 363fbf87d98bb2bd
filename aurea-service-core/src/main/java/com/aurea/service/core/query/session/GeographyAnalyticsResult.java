package com.aurea.service.core.query.session;

import java.util.List;

public record GeographyAnalyticsResult(
        List<CountryRow> countries,
        List<CityRow> cities,
        long totalSessions,
        long totalConversions,
        double totalRevenue) {

    public record CountryRow(
            String countryCode,
            String countryName,
            long sessions,
            long conversions,
            double revenue,
            long pageViews,
            double percentage,
            double conversionRate) {}

    public record CityRow(
            String city, String countryCode, String countryName, long sessions, long conversions, double percentage) {}
}
