package com.aurea.service.core.query.event;

/**
 * One micro-conversion type, category and description triple.
 *
 * @param eventName micro-conversion type
 */
public record TopMicroConversion(
        String eventName,
        String category,
        String description,
        long totalOccurrences,
        long uniqueSessions,
        double avgValue,
        long convertedSessions,
        double conversionRate) {}
