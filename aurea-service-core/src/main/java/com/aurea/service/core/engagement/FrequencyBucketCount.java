package com.aurea.service.core.engagement;

/** @param percentage share of all visitors, 0-100 */
public record FrequencyBucketCount(
        String bucket, String label, long visitorCount, long totalEvents, double percentage) {}
