package com.aurea.service.core.stage;

import java.util.List;

/**
 * @param totalSessions sessions of the first stage in canonical order
 * @param finalConversions sessions of the purchase stage
 * @param overallConversionRate purchase over first stage, fixed two decimals
 */
public record StageFlowResult(
        List<StageSnapshot> stages, long totalSessions, long finalConversions, String overallConversionRate) {}
