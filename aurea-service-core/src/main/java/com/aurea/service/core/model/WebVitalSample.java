package com.aurea.service.core.model;

import java.time.Instant;

/**
 * A single web-vital measurement reported for a page view, as opposed to the per-session averages on
 * {@link WebVitals}.
 *
 * @param metric metric name such as {@code LCP} or {@code CLS}
 * @param rating null when the reporter did not rate the value
 */
public record WebVitalSample(
        String id,
        String sessionId,
        String anonymousId,
        String pageUrl,
        String pagePath,
        String metric,
        double value,
        VitalRating rating,
        String deviceType,
        String browserName,
        String countryName,
        Instant timestamp) {}
