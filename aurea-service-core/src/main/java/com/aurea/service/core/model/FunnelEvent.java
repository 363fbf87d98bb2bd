package com.aurea.service.core.model;

import java.time.Instant;
import java.util.Map;

/** One timestamped, immutable occurrence within a session. */
public record FunnelEvent(
        String eventId,
        String sessionId,
        String anonymousId,
        String userId,
        String eventName,
        String eventCategory,
        String eventDescription,
        boolean microConversion,
        String microConversionType,
        Double microConversionValue,
        Double revenue,
        String pageUrl,
        String pageTitle,
        String pagePath,
        boolean conversion,
        String funnelStage,
        String utmSource,
        String utmMedium,
        String utmCampaign,
        DeviceInfo device,
        Geography geography,
        Map<String, Object> properties,
        Instant timestamp) {

    public static final String PAGE_VIEW = "page_view";
    public static final String UNCATEGORIZED = "uncategorized";

    public FunnelEvent {
        device = device == null ? DeviceInfo.unknown() : device;
        geography = geography == null ? Geography.unknown() : geography;
        properties = properties == null ? Map.of() : properties;
    }

    public double revenueOrZero() {
        return revenue == null ? 0.0d : revenue;
    }

    public boolean pageView() {
        return PAGE_VIEW.equals(eventName);
    }

    public String categoryOrDefault() {
        return eventCategory == null || eventCategory.isBlank() ? UNCATEGORIZED : eventCategory;
    }

    /** Identified user id when present, otherwise the anonymous id; may be null. */
    public String visitorKey() {
        return userId != null && !userId.isBlank() ? userId : anonymousId;
    }
}
