package com.aurea.service.core.stage;

/**
 * Sessions currently sitting in one stage.
 *
 * @param avgTimeInStageSeconds mean session length of ended sessions, null when none has ended
 */
public record StageCount(
        String stage, long sessions, long conversions, Double avgTimeInStageSeconds, long abandonments) {}
