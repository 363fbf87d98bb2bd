package com.aurea.service.core.flow;

public record FlowMetrics(long totalSessions, long convertedSessions, double conversionRate, double dropOffRate) {}
