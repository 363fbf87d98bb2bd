package com.aurea.service.core.model;

import java.time.Instant;

/** Cross-session identity for a visitor. {@code lifecycleStage} stays null until first classified. */
public record VisitorProfile(
        String id,
        String displayName,
        String identifiedUserId,
        Instant firstSeen,
        Instant lastSeen,
        int totalSessions,
        int totalEvents,
        LifecycleStage lifecycleStage) {

    public VisitorProfile withLifecycleStage(LifecycleStage stage) {
        return new VisitorProfile(
                id, displayName, identifiedUserId, firstSeen, lastSeen, totalSessions, totalEvents, stage);
    }
}
