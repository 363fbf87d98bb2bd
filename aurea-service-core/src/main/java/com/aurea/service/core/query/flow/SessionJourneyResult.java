package com.aurea.service.core.query.flow;

import com.aurea.service.core.model.StageEntry;
import java.time.Instant;
import java.util.List;

public record SessionJourneyResult(Session session, List<Step> events, List<StageEntry> stageHistory) {

    public record Session(
            String sessionId,
            String anonymousId,
            Instant startedAt,
            Instant endedAt,
            String currentStage,
            boolean converted,
            Double conversionValue,
            Integer durationSeconds,
            Integer activeTimeSeconds,
            Double engagementRate,
            String deviceType,
            String browserName,
            String city,
            String countryName) {}

    public record Step(
            String eventId,
            String eventName,
            String category,
            String description,
            String microConversionType,
            Double value,
            String stage,
            Instant timestamp,
            String pageUrl,
            String pageTitle) {}
}
