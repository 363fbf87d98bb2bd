package com.aurea.service.core.engagement;

import com.aurea.service.core.model.FunnelEvent;
import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.rollup.RollupAggregator;
import com.aurea.service.core.support.Percentages;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Per-event engagement and per-visitor frequency histograms.
 *
 * <p>Engagement of a session is active time over duration, capped at 100. An event's engagement is the mean over the
 * distinct sessions in which it occurred; repeated occurrences inside one session do not weigh that session more.
 */
@Component
public class EngagementScorer {

    public static double sessionEngagement(int activeTimeSeconds, int durationSeconds) {
        if (durationSeconds <= 0) {
            return 0.0d;
        }
        return Math.min((double) activeTimeSeconds / durationSeconds * 100.0d, 100.0d);
    }

    /**
     * @param sessions sessions of the window; only those with a measured engagement rate participate
     * @param events events of the window; events of non-participating sessions are ignored
     */
    public EngagementReport eventEngagement(
            Collection<FunnelSession> sessions, Collection<FunnelEvent> events, int limit) {
        Map<String, FunnelSession> participating = new HashMap<>();
        for (FunnelSession session : sessions) {
            if (session.engagementRate() != null && session.sessionId() != null) {
                participating.put(session.sessionId(), session);
            }
        }
        if (participating.isEmpty()) {
            return new EngagementReport(0, 0.0d, List.of());
        }

        Map<String, EventAccumulator> byEvent = new LinkedHashMap<>();
        for (FunnelEvent event : events) {
            FunnelSession session = participating.get(event.sessionId());
            if (session == null) {
                continue;
            }
            byEvent.computeIfAbsent(event.eventName(), k -> new EventAccumulator()).add(session);
        }

        List<Scored> scored = new ArrayList<>(byEvent.size());
        byEvent.forEach((name, acc) -> scored.add(acc.score(name)));
        scored.sort(Comparator.comparingDouble(Scored::exactEngagement).reversed());
        List<EventEngagement> rows = new ArrayList<>(scored.size());
        for (Scored s : scored) {
            rows.add(s.row());
        }

        return new EngagementReport(
                participating.size(),
                Percentages.round(overallEngagement(participating.values()), 1),
                RollupAggregator.limit(List.copyOf(rows), limit));
    }

    /** Mean of the stored engagement rates; sessions without one are skipped. */
    public double overallEngagement(Collection<FunnelSession> sessions) {
        double total = 0.0d;
        long count = 0;
        for (FunnelSession session : sessions) {
            if (session.engagementRate() != null) {
                total += session.engagementRate();
                count++;
            }
        }
        return Percentages.average(total, count);
    }

    public FrequencyDistribution frequencyDistribution(Collection<FunnelEvent> events, String eventName) {
        Map<String, Long> perVisitor = new HashMap<>();
        long totalEvents = 0;
        for (FunnelEvent event : events) {
            if (eventName != null && !eventName.equals(event.eventName())) {
                continue;
            }
            totalEvents++;
            String visitor = event.visitorKey();
            if (visitor != null && !visitor.isBlank()) {
                perVisitor.merge(visitor, 1L, Long::sum);
            }
        }

        Map<FrequencyBucket, long[]> buckets = new EnumMap<>(FrequencyBucket.class);
        for (long occurrences : perVisitor.values()) {
            long[] tally = buckets.computeIfAbsent(FrequencyBucket.of(occurrences), k -> new long[2]);
            tally[0]++;
            tally[1] += occurrences;
        }

        long visitors = perVisitor.size();
        List<FrequencyBucketCount> distribution = new ArrayList<>(buckets.size());
        for (Map.Entry<FrequencyBucket, long[]> entry : buckets.entrySet()) {
            FrequencyBucket bucket = entry.getKey();
            long[] tally = entry.getValue();
            distribution.add(new FrequencyBucketCount(
                    bucket.wireValue(), bucket.label(), tally[0], tally[1], Percentages.percent(tally[0], visitors)));
        }
        return new FrequencyDistribution(
                eventName, visitors, totalEvents, Percentages.average(totalEvents, visitors), List.copyOf(distribution));
    }

    private record Scored(double exactEngagement, EventEngagement row) {}

    private static final class EventAccumulator {
        private long occurrences;
        private final Map<String, FunnelSession> sessions = new LinkedHashMap<>();

        void add(FunnelSession session) {
            occurrences++;
            sessions.putIfAbsent(session.sessionId(), session);
        }

        Scored score(String eventName) {
            long totalDuration = 0;
            long totalActive = 0;
            double totalEngagement = 0.0d;
            long conversions = 0;
            double revenue = 0.0d;
            for (FunnelSession session : sessions.values()) {
                totalDuration += session.durationOrZero();
                totalActive += session.activeTimeOrZero();
                totalEngagement += sessionEngagement(session.activeTimeOrZero(), session.durationOrZero());
                if (session.converted()) {
                    conversions++;
                    revenue += session.conversionValueOrZero();
                }
            }
            long count = sessions.size();
            double avgEngagement = Percentages.average(totalEngagement, count);
            EventEngagement row = new EventEngagement(
                    eventName,
                    occurrences,
                    count,
                    Percentages.round(avgEngagement, 1),
                    Math.round(Percentages.average(totalDuration, count)),
                    Math.round(Percentages.average(totalActive, count)),
                    conversions,
                    Percentages.round(Percentages.percent(conversions, count), 1),
                    revenue);
            return new Scored(avgEngagement, row);
        }
    }
}
