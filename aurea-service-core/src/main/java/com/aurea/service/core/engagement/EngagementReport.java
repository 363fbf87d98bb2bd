package com.aurea.service.core.engagement;

import java.util.List;

/** @param avgEngagement mean of the stored session engagement rates, one decimal */
public record EngagementReport(long totalSessions, double avgEngagement, List<EventEngagement> events) {}
