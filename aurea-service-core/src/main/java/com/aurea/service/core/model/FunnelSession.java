package com.aurea.service.core.model;

import java.time.Instant;
import java.util.List;

/**
 * One visitor's bounded interaction window inside a funnel. Read-only from the analytics point of view.
 */
public record FunnelSession(
        String sessionId,
        String anonymousId,
        String userId,
        Instant startedAt,
        Instant endedAt,
        int pageViews,
        int eventsCount,
        Integer durationSeconds,
        Integer activeTimeSeconds,
        Double engagementRate,
        String currentStage,
        List<StageEntry> stageHistory,
        boolean abandoned,
        boolean converted,
        Double conversionValue,
        String conversionPlatform,
        TouchAttribution firstTouch,
        TouchAttribution lastTouch,
        DeviceInfo device,
        Geography geography,
        WebVitals vitals,
        Integer experienceScore) {

    public FunnelSession {
        stageHistory = stageHistory == null ? List.of() : List.copyOf(stageHistory);
        firstTouch = firstTouch == null ? TouchAttribution.empty() : firstTouch;
        lastTouch = lastTouch == null ? TouchAttribution.empty() : lastTouch;
        device = device == null ? DeviceInfo.unknown() : device;
        geography = geography == null ? Geography.unknown() : geography;
        vitals = vitals == null ? WebVitals.none() : vitals;
    }

    public double conversionValueOrZero() {
        return conversionValue == null ? 0.0d : conversionValue;
    }

    public int durationOrZero() {
        return durationSeconds == null ? 0 : durationSeconds;
    }

    public int activeTimeOrZero() {
        return activeTimeSeconds == null ? 0 : activeTimeSeconds;
    }

    /** Identified user id when present, otherwise the anonymous id. */
    public String visitorKey() {
        return userId != null && !userId.isBlank() ? userId : anonymousId;
    }
}
