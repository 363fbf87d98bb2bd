package com.aurea.service.core.query.event;

import com.aurea.service.core.engagement.EngagementReport;
import com.aurea.service.core.engagement.EngagementScorer;
import com.aurea.service.core.engagement.FrequencyDistribution;
import com.aurea.service.core.model.FunnelEvent;
import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.model.Geography;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.EventFilter;
import com.aurea.service.core.repo.EventRepository;
import com.aurea.service.core.repo.SessionRepository;
import com.aurea.service.core.rollup.GroupRollup;
import com.aurea.service.core.rollup.RollupAggregator;
import com.aurea.service.core.rollup.RollupMetrics;
import com.aurea.service.core.support.Percentages;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Event breakdowns by environment and payload. An absent event name covers every event and is reported as
 * {@code All Events}.
 */
@Service
public class EventBreakdownService {
    private static final Logger log = LoggerFactory.getLogger(EventBreakdownService.class);

    static final String ALL_EVENTS = "All Events";

    private final FunnelLookup funnelLookup;
    private final EventRepository eventRepository;
    private final SessionRepository sessionRepository;
    private final EngagementScorer engagementScorer;

    public EventBreakdownService(
            FunnelLookup funnelLookup,
            EventRepository eventRepository,
            SessionRepository sessionRepository,
            EngagementScorer engagementScorer) {
        this.funnelLookup = funnelLookup;
        this.eventRepository = eventRepository;
        this.sessionRepository = sessionRepository;
        this.engagementScorer = engagementScorer;
    }

    public EventDevicesResult devices(UUID funnelId, TimeWindow window, String eventName, int limit) {
        List<FunnelEvent> events = load(funnelId, window, eventName);
        List<GroupRollup> groups = RollupAggregator.rollup(events, e -> e.device().deviceType(), revenue());
        List<EventDevicesResult.DeviceRow> rows = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.limit(groups, limit)) {
            rows.add(new EventDevicesResult.DeviceRow(
                    group.key(), group.count(), group.revenue(), Percentages.round(group.percentage(), 1)));
        }
        return new EventDevicesResult(label(eventName), events.size(), groups.size(), List.copyOf(rows));
    }

    public EventBrowsersResult browsers(UUID funnelId, TimeWindow window, String eventName, int limit) {
        List<FunnelEvent> events = load(funnelId, window, eventName);
        List<Function<FunnelEvent, String>> versionKeys =
                List.of(e -> e.device().browserName(), e -> e.device().browserVersion());
        Map<String, List<GroupRollup>> versions = new LinkedHashMap<>();
        for (GroupRollup version : RollupAggregator.rollupByMultipleKeys(events, versionKeys, RollupMetrics.countOnly())) {
            versions.computeIfAbsent(version.dimension(0), k -> new ArrayList<>()).add(version);
        }

        List<GroupRollup> groups = RollupAggregator.rollup(events, e -> e.device().browserName(), revenue());
        List<EventBrowsersResult.BrowserRow> rows = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.limit(groups, limit)) {
            List<GroupRollup> browserVersions = versions.getOrDefault(group.key(), List.of());
            rows.add(new EventBrowsersResult.BrowserRow(
                    group.key(),
                    group.count(),
                    group.revenue(),
                    Percentages.round(group.percentage(), 1),
                    browserVersions.isEmpty() ? RollupAggregator.UNKNOWN_KEY : browserVersions.get(0).dimension(1),
                    browserVersions.size()));
        }
        return new EventBrowsersResult(label(eventName), events.size(), groups.size(), List.copyOf(rows));
    }

    public EventGeographyResult geography(UUID funnelId, TimeWindow window, String eventName, int limit) {
        List<FunnelEvent> events = load(funnelId, window, eventName);
        Map<String, String> countryNames = new LinkedHashMap<>();
        for (FunnelEvent event : events) {
            countryNames.putIfAbsent(countryCode(event), countryName(event));
        }

        List<GroupRollup> countryGroups = RollupAggregator.rollup(events, EventBreakdownService::countryCode, revenue());
        List<EventGeographyResult.CountryRow> countries = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.limit(countryGroups, limit)) {
            countries.add(new EventGeographyResult.CountryRow(
                    group.key(),
                    countryNames.get(group.key()),
                    group.count(),
                    group.revenue(),
                    Percentages.round(group.percentage(), 1)));
        }

        List<FunnelEvent> withCity =
                events.stream().filter(e -> e.geography().city() != null).toList();
        List<Function<FunnelEvent, String>> cityKeys =
                List.of(e -> e.geography().city(), EventBreakdownService::countryCode);
        List<GroupRollup> cityGroups = RollupAggregator.rollupByMultipleKeys(withCity, cityKeys, revenue());
        List<EventGeographyResult.CityRow> cities = new ArrayList<>();
        for (GroupRollup group : RollupAggregator.limit(cityGroups, limit)) {
            cities.add(new EventGeographyResult.CityRow(
                    group.dimension(0),
                    countryNames.get(group.dimension(1)),
                    group.count(),
                    Percentages.round(Percentages.percent(group.count(), events.size()), 1)));
        }
        return new EventGeographyResult(
                label(eventName),
                events.size(),
                countryGroups.size(),
                cityGroups.size(),
                List.copyOf(countries),
                List.copyOf(cities));
    }

    /** Value rollups per property key discovered in the events; missing or empty values count as Unknown. */
    public PropertiesBreakdownResult propertiesBreakdown(
            UUID funnelId, TimeWindow window, String eventName, int limit) {
        requireEventName(eventName);
        List<FunnelEvent> events = load(funnelId, window, eventName);
        Map<String, List<GroupRollup>> byKey = RollupAggregator.groupBy(
                events, e -> e.properties().keySet(), EventBreakdownService::propertyValue, revenue());

        List<PropertiesBreakdownResult.Property> properties = new ArrayList<>(byKey.size());
        byKey.forEach((key, groups) -> {
            List<PropertiesBreakdownResult.Value> values = new ArrayList<>();
            for (GroupRollup group : RollupAggregator.limit(groups, limit)) {
                values.add(new PropertiesBreakdownResult.Value(
                        group.key(), group.count(), group.revenue(), Percentages.round(group.percentage(), 1)));
            }
            properties.add(new PropertiesBreakdownResult.Property(key, values.size(), List.copyOf(values)));
        });
        return new PropertiesBreakdownResult(eventName, events.size(), List.copyOf(properties));
    }

    public FrequencyDistribution frequency(UUID funnelId, TimeWindow window, String eventName) {
        requireEventName(eventName);
        List<FunnelEvent> events = load(funnelId, window, eventName);
        return engagementScorer.frequencyDistribution(events, eventName);
    }

    public EngagementReport engagement(UUID funnelId, TimeWindow window, int limit) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelSession> sessions = sessionRepository.findWithEngagementInWindow(funnelId, window);
        if (sessions.isEmpty()) {
            return new EngagementReport(0, 0.0d, List.of());
        }
        Set<String> sessionIds = sessions.stream()
                .map(FunnelSession::sessionId)
                .collect(Collectors.toSet());
        List<FunnelEvent> events = eventRepository.findInWindow(funnelId, window, EventFilter.forSessions(sessionIds));
        log.debug("Event engagement funnel={} sessions={} events={}", funnelId, sessions.size(), events.size());
        return engagementScorer.eventEngagement(sessions, events, limit);
    }

    private List<FunnelEvent> load(UUID funnelId, TimeWindow window, String eventName) {
        funnelLookup.requireFunnel(funnelId);
        EventFilter filter = eventName == null || eventName.isBlank() ? EventFilter.all() : EventFilter.named(eventName);
        return eventRepository.findInWindow(funnelId, window, filter);
    }

    private static RollupMetrics<FunnelEvent> revenue() {
        return RollupMetrics.of(FunnelEvent::revenueOrZero, FunnelEvent::conversion);
    }

    private static String label(String eventName) {
        return eventName == null || eventName.isBlank() ? ALL_EVENTS : eventName;
    }

    private static void requireEventName(String eventName) {
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName is required");
        }
    }

    static String countryCode(FunnelEvent event) {
        String code = event.geography().countryCode();
        return code == null || code.isBlank() ? Geography.UNKNOWN : code;
    }

    private static String countryName(FunnelEvent event) {
        String name = event.geography().countryName();
        return name == null || name.isBlank() ? countryCode(event) : name;
    }

    static String propertyValue(FunnelEvent event, String key) {
        Object value = event.properties().get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isEmpty() ? null : text;
    }
}
