package com.aurea.service.core.query.event;

import java.util.List;

public record EventGeographyResult(
        String eventName,
        long totalEvents,
        long totalCountries,
        long totalCities,
        List<CountryRow> countries,
        List<CityRow> cities) {

    public record CountryRow(String countryCode, String countryName, long count, double revenue, double percentage) {}

    public record CityRow(String city, String countryName, long count, double percentage) {}
}
