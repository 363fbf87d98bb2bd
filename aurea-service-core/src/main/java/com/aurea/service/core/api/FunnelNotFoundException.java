package com.aurea.service.core.api;

import java.util.UUID;

public class FunnelNotFoundException extends AnalyticsNotFoundException {

    private final UUID funnelId;

    public FunnelNotFoundException(UUID funnelId) {
        super("Funnel not found: " + funnelId);
        this.funnelId = funnelId;
    }

    public UUID funnelId() {
        return funnelId;
    }
}
