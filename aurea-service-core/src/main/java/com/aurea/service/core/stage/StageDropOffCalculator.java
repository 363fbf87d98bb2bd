package com.aurea.service.core.stage;

import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.support.Percentages;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Orders stages canonically and computes drop-off between adjacent stages.
 *
 * <p>Adjacency comes from the canonical order only. Drop-off is {@code (previous - current) / previous * 100} and
 * may be negative; such values are returned unchanged.
 */
@Component
public class StageDropOffCalculator {

    /**
     * Groups sessions by their current stage, skipping sessions without one. Keeps first-seen order. Canonical stages
     * match case-insensitively and are reported by their wire value; other names are grouped as written.
     */
    public List<StageCount> countByCurrentStage(Collection<FunnelSession> sessions) {
        Map<String, StageAccumulator> byStage = new LinkedHashMap<>();
        for (FunnelSession session : sessions) {
            if (session.currentStage() == null || session.currentStage().isBlank()) {
                continue;
            }
            byStage.computeIfAbsent(stageKey(session.currentStage()), k -> new StageAccumulator()).add(session);
        }
        List<StageCount> counts = new ArrayList<>(byStage.size());
        byStage.forEach((stage, acc) -> counts.add(acc.toCount(stage)));
        return counts;
    }

    static String stageKey(String stage) {
        CanonicalStage canonical = CanonicalStage.fromValue(stage);
        return canonical == null ? stage : canonical.wireValue();
    }

    public StageFlowResult stageFlow(Collection<StageCount> counts) {
        List<StageCount> ordered = new ArrayList<>(counts);
        ordered.sort(Comparator.comparingInt(c -> CanonicalStage.rankOf(c.stage())));

        List<StageSnapshot> snapshots = new ArrayList<>(ordered.size());
        StageCount previous = null;
        for (StageCount current : ordered) {
            double dropOff = previous == null
                    ? 0.0d
                    : Percentages.percent(previous.sessions() - current.sessions(), previous.sessions());
            snapshots.add(new StageSnapshot(
                    current.stage(),
                    current.sessions(),
                    current.conversions(),
                    Percentages.round(Percentages.percent(current.conversions(), current.sessions()), 2),
                    current.avgTimeInStageSeconds() == null ? null : Math.round(current.avgTimeInStageSeconds()),
                    current.abandonments(),
                    Percentages.round(dropOff, 2),
                    CanonicalStage.fromValue(current.stage()) != null));
            previous = current;
        }

        long first = snapshots.isEmpty() ? 0L : snapshots.get(0).sessions();
        long purchase = snapshots.stream()
                .filter(s -> CanonicalStage.fromValue(s.stage()) == CanonicalStage.PURCHASE)
                .mapToLong(StageSnapshot::sessions)
                .findFirst()
                .orElse(0L);
        String overall = first == 0L ? "0.00" : Percentages.format2(Percentages.percent(purchase, first));
        return new StageFlowResult(List.copyOf(snapshots), first, purchase, overall);
    }

    private static final class StageAccumulator {
        private long sessions;
        private long conversions;
        private long abandonments;
        private long endedSessions;
        private double endedSeconds;

        void add(FunnelSession session) {
            sessions++;
            if (session.converted()) {
                conversions++;
            }
            if (session.abandoned()) {
                abandonments++;
            }
            if (session.endedAt() != null && session.startedAt() != null) {
                endedSessions++;
                endedSeconds += Duration.between(session.startedAt(), session.endedAt()).toMillis() / 1000.0d;
            }
        }

        StageCount toCount(String stage) {
            Double avg = endedSessions == 0 ? null : endedSeconds / endedSessions;
            return new StageCount(stage, sessions, conversions, avg, abandonments);
        }
    }
}
