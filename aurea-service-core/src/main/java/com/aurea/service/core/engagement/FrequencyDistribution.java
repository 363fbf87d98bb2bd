package com.aurea.service.core.engagement;

import java.util.List;

public record FrequencyDistribution(
        String eventName,
        long totalVisitors,
        long totalEvents,
        double avgFrequency,
        List<FrequencyBucketCount> distribution) {}
