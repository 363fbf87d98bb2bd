package com.aurea.service.core.query.event;

import com.aurea.service.core.config.AnalyticsProperties;
import com.aurea.service.core.model.FunnelEvent;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.EventFilter;
import com.aurea.service.core.repo.EventRepository;
import com.aurea.service.core.repo.SessionRepository;
import com.aurea.service.core.rollup.RollupAggregator;
import com.aurea.service.core.support.Percentages;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Micro-conversion analyses: which small signals occur in sessions that go on to convert. */
@Service
public class MicroConversionService {
    private static final Logger log = LoggerFactory.getLogger(MicroConversionService.class);

    private final FunnelLookup funnelLookup;
    private final EventRepository eventRepository;
    private final SessionRepository sessionRepository;
    private final AnalyticsProperties properties;

    public MicroConversionService(
            FunnelLookup funnelLookup,
            EventRepository eventRepository,
            SessionRepository sessionRepository,
            AnalyticsProperties properties) {
        this.funnelLookup = funnelLookup;
        this.eventRepository = eventRepository;
        this.sessionRepository = sessionRepository;
        this.properties = properties;
    }

    public CategoryBreakdownResult categoryBreakdown(UUID funnelId, TimeWindow window) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelEvent> events = eventRepository.findInWindow(funnelId, window, EventFilter.microConversions());
        Set<String> converted = convertedSessions(funnelId, events);

        Map<String, Group> byCategory = new LinkedHashMap<>();
        for (FunnelEvent event : events) {
            byCategory.computeIfAbsent(event.categoryOrDefault(), k -> new Group()).add(event);
        }

        List<CategoryBreakdownResult.Category> categories = new ArrayList<>(byCategory.size());
        byCategory.forEach((category, group) -> {
            long convertedSessions = group.convertedSessions(converted);
            categories.add(new CategoryBreakdownResult.Category(
                    category,
                    group.occurrences,
                    group.avgValue(),
                    group.sessions.size(),
                    convertedSessions,
                    Percentages.round(Percentages.percent(convertedSessions, group.sessions.size()), 2)));
        });
        categories.sort(Comparator.comparingLong(CategoryBreakdownResult.Category::count).reversed());
        return new CategoryBreakdownResult(List.copyOf(categories), events.size());
    }

    /**
     * Micro-conversions keyed by type, category and description. Only keys seen in at least the configured minimum
     * number of distinct sessions are reported, best conversion rate first.
     */
    public List<TopMicroConversion> topMicroConversions(UUID funnelId, TimeWindow window, int limit) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelEvent> events = eventRepository.findInWindow(funnelId, window, EventFilter.microConversions());
        Set<String> converted = convertedSessions(funnelId, events);
        int minSessions = properties.getMicroConversions().getMinSessions();

        // key parts may be null
        Map<List<String>, Group> byKey = new LinkedHashMap<>();
        for (FunnelEvent event : events) {
            List<String> key = Arrays.asList(
                    event.microConversionType(), event.eventCategory(), event.eventDescription());
            byKey.computeIfAbsent(key, k -> new Group()).add(event);
        }

        List<TopMicroConversion> out = new ArrayList<>();
        byKey.forEach((key, group) -> {
            if (group.sessions.size() < minSessions) {
                return;
            }
            long convertedSessions = group.convertedSessions(converted);
            String category = key.get(1) == null || key.get(1).isBlank() ? FunnelEvent.UNCATEGORIZED : key.get(1);
            out.add(new TopMicroConversion(
                    key.get(0),
                    category,
                    key.get(2),
                    group.occurrences,
                    group.sessions.size(),
                    group.avgValue(),
                    convertedSessions,
                    Percentages.round(Percentages.percent(convertedSessions, group.sessions.size()), 2)));
        });
        out.sort(Comparator.comparingDouble(TopMicroConversion::conversionRate)
                .thenComparingLong(TopMicroConversion::uniqueSessions)
                .reversed());
        log.debug("Top micro-conversions funnel={} keys={} reported={}", funnelId, byKey.size(), out.size());
        return RollupAggregator.limit(out, limit);
    }

    private Set<String> convertedSessions(UUID funnelId, List<FunnelEvent> events) {
        Set<String> sessionIds = events.stream()
                .map(FunnelEvent::sessionId)
                .filter(id -> id != null)
                .collect(Collectors.toSet());
        if (sessionIds.isEmpty()) {
            return Set.of();
        }
        return sessionRepository.findConvertedSessionIds(funnelId, sessionIds);
    }

    private static final class Group {
        private final Set<String> sessions = new HashSet<>();
        private long occurrences;
        private double valueTotal;
        private long valueCount;

        void add(FunnelEvent event) {
            occurrences++;
            if (event.sessionId() != null) {
                sessions.add(event.sessionId());
            }
            if (event.microConversionValue() != null) {
                valueTotal += event.microConversionValue();
                valueCount++;
            }
        }

        double avgValue() {
            return Percentages.round(Percentages.average(valueTotal, valueCount), 1);
        }

        long convertedSessions(Set<String> converted) {
            return sessions.stream().filter(converted::contains).count();
        }
    }
}
