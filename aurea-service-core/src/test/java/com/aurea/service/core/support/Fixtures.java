package com.aurea.service.core.support;

import com.aurea.service.core.model.DeviceInfo;
import com.aurea.service.core.model.FunnelEvent;
import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.model.Geography;
import com.aurea.service.core.model.StageEntry;
import com.aurea.service.core.model.TouchAttribution;
import com.aurea.service.core.model.WebVitals;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builders for sessions and events used across the engine tests. */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2025-03-02T00:00:00Z");

    private Fixtures() {}

    public static SessionBuilder session(String sessionId) {
        return new SessionBuilder(sessionId);
    }

    public static EventBuilder event(String eventId, String sessionId) {
        return new EventBuilder(eventId, sessionId);
    }

    public static final class SessionBuilder {
        private final String sessionId;
        private String anonymousId;
        private String userId;
        private Instant startedAt = T0;
        private Instant endedAt;
        private int pageViews;
        private int eventsCount;
        private Integer durationSeconds;
        private Integer activeTimeSeconds;
        private Double engagementRate;
        private String currentStage;
        private List<StageEntry> stageHistory = new ArrayList<>();
        private boolean abandoned;
        private boolean converted;
        private Double conversionValue;
        private String conversionPlatform;
        private TouchAttribution firstTouch;
        private TouchAttribution lastTouch;
        private DeviceInfo device;
        private Geography geography;
        private WebVitals vitals;
        private Integer experienceScore;

        private SessionBuilder(String sessionId) {
            this.sessionId = sessionId;
            this.anonymousId = "anon-" + sessionId;
        }

        public SessionBuilder visitor(String anonymousId) {
            this.anonymousId = anonymousId;
            return this;
        }

        public SessionBuilder user(String userId) {
            this.userId = userId;
            return this;
        }

        public SessionBuilder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public SessionBuilder endedAt(Instant endedAt) {
            this.endedAt = endedAt;
            return this;
        }

        public SessionBuilder pageViews(int pageViews) {
            this.pageViews = pageViews;
            return this;
        }

        public SessionBuilder duration(Integer durationSeconds, Integer activeTimeSeconds) {
            this.durationSeconds = durationSeconds;
            this.activeTimeSeconds = activeTimeSeconds;
            return this;
        }

        public SessionBuilder engagementRate(Double engagementRate) {
            this.engagementRate = engagementRate;
            return this;
        }

        public SessionBuilder stage(String currentStage) {
            this.currentStage = currentStage;
            return this;
        }

        public SessionBuilder stageHistory(StageEntry... entries) {
            this.stageHistory = new ArrayList<>(List.of(entries));
            return this;
        }

        public SessionBuilder abandoned() {
            this.abandoned = true;
            return this;
        }

        public SessionBuilder converted(double value) {
            this.converted = true;
            this.conversionValue = value;
            return this;
        }

        public SessionBuilder platform(String conversionPlatform) {
            this.conversionPlatform = conversionPlatform;
            return this;
        }

        public SessionBuilder firstTouch(TouchAttribution firstTouch) {
            this.firstTouch = firstTouch;
            return this;
        }

        public SessionBuilder lastTouch(TouchAttribution lastTouch) {
            this.lastTouch = lastTouch;
            return this;
        }

        public SessionBuilder device(String deviceType, String browserName, String osName) {
            this.device = new DeviceInfo(deviceType, browserName, null, osName, null);
            return this;
        }

        public SessionBuilder geography(String countryCode, String countryName, String city) {
            this.geography = new Geography(countryCode, countryName, null, city);
            return this;
        }

        public SessionBuilder vitals(WebVitals vitals, Integer experienceScore) {
            this.vitals = vitals;
            this.experienceScore = experienceScore;
            return this;
        }

        public FunnelSession build() {
            return new FunnelSession(
                    sessionId,
                    anonymousId,
                    userId,
                    startedAt,
                    endedAt,
                    pageViews,
                    eventsCount,
                    durationSeconds,
                    activeTimeSeconds,
                    engagementRate,
                    currentStage,
                    stageHistory,
                    abandoned,
                    converted,
                    conversionValue,
                    conversionPlatform,
                    firstTouch,
                    lastTouch,
                    device,
                    geography,
                    vitals,
                    experienceScore);
        }
    }

    public static final class EventBuilder {
        private final String eventId;
        private final String sessionId;
        private String anonymousId;
        private String userId;
        private String eventName = FunnelEvent.PAGE_VIEW;
        private String category;
        private String description;
        private boolean microConversion;
        private String microConversionType;
        private Double microConversionValue;
        private Double revenue;
        private String pageTitle;
        private String pagePath;
        private boolean conversion;
        private String utmSource;
        private String utmMedium;
        private String utmCampaign;
        private DeviceInfo device;
        private Geography geography;
        private final Map<String, Object> properties = new LinkedHashMap<>();
        private Instant timestamp = T0;

        private EventBuilder(String eventId, String sessionId) {
            this.eventId = eventId;
            this.sessionId = sessionId;
            this.anonymousId = "anon-" + sessionId;
        }

        public EventBuilder visitor(String anonymousId, String userId) {
            this.anonymousId = anonymousId;
            this.userId = userId;
            return this;
        }

        public EventBuilder name(String eventName) {
            this.eventName = eventName;
            return this;
        }

        public EventBuilder category(String category) {
            this.category = category;
            return this;
        }

        public EventBuilder page(String pagePath, String pageTitle) {
            this.pagePath = pagePath;
            this.pageTitle = pageTitle;
            return this;
        }

        public EventBuilder micro(String type, String description, Double value) {
            this.microConversion = true;
            this.microConversionType = type;
            this.description = description;
            this.microConversionValue = value;
            return this;
        }

        public EventBuilder conversion(Double revenue) {
            this.conversion = true;
            this.revenue = revenue;
            return this;
        }

        public EventBuilder revenue(Double revenue) {
            this.revenue = revenue;
            return this;
        }

        public EventBuilder utm(String source, String medium, String campaign) {
            this.utmSource = source;
            this.utmMedium = medium;
            this.utmCampaign = campaign;
            return this;
        }

        public EventBuilder device(String deviceType, String browserName, String browserVersion) {
            this.device = new DeviceInfo(deviceType, browserName, browserVersion, null, null);
            return this;
        }

        public EventBuilder geography(String countryCode, String countryName, String city) {
            this.geography = new Geography(countryCode, countryName, null, city);
            return this;
        }

        public EventBuilder property(String key, Object value) {
            this.properties.put(key, value);
            return this;
        }

        public EventBuilder at(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public FunnelEvent build() {
            return new FunnelEvent(
                    eventId,
                    sessionId,
                    anonymousId,
                    userId,
                    eventName,
                    category,
                    description,
                    microConversion,
                    microConversionType,
                    microConversionValue,
                    revenue,
                    null,
                    pageTitle,
                    pagePath,
                    conversion,
                    null,
                    utmSource,
                    utmMedium,
                    utmCampaign,
                    device,
                    geography,
                    new LinkedHashMap<>(properties),
                    timestamp);
        }
    }
}
