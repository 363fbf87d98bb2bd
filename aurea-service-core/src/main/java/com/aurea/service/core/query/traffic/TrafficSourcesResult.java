package com.aurea.service.core.query.traffic;

import java.util.List;

public record TrafficSourcesResult(List<Row> trafficSources) {

    /** Sessions grouped by first-touch source, medium and campaign. */
    public record Row(String source, String medium, String campaign, long sessions, double revenue) {}
}
