package com.aurea.service.core.query.event;

import java.util.List;

public record EventBrowsersResult(String eventName, long totalEvents, long totalBrowsers, List<BrowserRow> browsers) {

    /**
     * @param topVersion most frequent version, first seen wins ties
     * @param totalVersions distinct versions seen for this browser
     */
    public record BrowserRow(
            String browserName, long count, double revenue, double percentage, String topVersion, long totalVersions) {}
}
