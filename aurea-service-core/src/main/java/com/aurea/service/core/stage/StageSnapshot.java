package com.aurea.service.core.stage;

/**
 * One stage of the stage flow.
 *
 * @param dropOffRate decline from the previous stage in percent, two decimals; negative when this stage holds more
 *     sessions than the previous one
 * @param canonical false for stages outside the canonical list
 */
public record StageSnapshot(
        String stage,
        long sessions,
        long conversions,
        double conversionRate,
        Long avgTimeInStage,
        long abandonments,
        double dropOffRate,
        boolean canonical) {}
