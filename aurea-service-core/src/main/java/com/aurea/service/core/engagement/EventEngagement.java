package com.aurea.service.core.engagement;

/**
 * Engagement of the sessions in which one event occurred.
 *
 * @param occurrences raw event count
 * @param sessions distinct participating sessions
 * @param avgEngagement mean per-session engagement, 0-100, one decimal
 * @param avgDuration mean session duration in seconds, rounded
 * @param avgActiveTime mean active time in seconds, rounded
 */
public record EventEngagement(
        String eventName,
        long occurrences,
        long sessions,
        double avgEngagement,
        long avgDuration,
        long avgActiveTime,
        long conversions,
        double conversionRate,
        double revenue) {}
