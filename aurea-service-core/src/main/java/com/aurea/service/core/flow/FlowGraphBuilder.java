package com.aurea.service.core.flow;

import com.aurea.service.core.model.FunnelEvent;
import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.support.Percentages;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Builds the page/event transition graph used by flow (Sankey) views.
 *
 * <p>Events are grouped per session and replayed in timestamp order. A node counts distinct sessions, so a session
 * revisiting the same page adds to the node once but still contributes every transition to the edges.
 */
@Component
public class FlowGraphBuilder {

    static final String UNKNOWN = "Unknown";

    public FlowGraph build(Collection<FunnelEvent> events, Collection<FunnelSession> sessions) {
        Map<String, List<FunnelEvent>> bySession = new LinkedHashMap<>();
        for (FunnelEvent event : events) {
            if (event.sessionId() == null) {
                continue;
            }
            bySession.computeIfAbsent(event.sessionId(), k -> new ArrayList<>()).add(event);
        }

        Map<String, String> labels = new LinkedHashMap<>();
        Map<String, Set<String>> nodeSessions = new LinkedHashMap<>();
        Map<List<String>, long[]> edgeWeights = new LinkedHashMap<>();

        for (Map.Entry<String, List<FunnelEvent>> entry : bySession.entrySet()) {
            List<FunnelEvent> ordered = new ArrayList<>(entry.getValue());
            ordered.sort(Comparator.comparing(FunnelEvent::timestamp, Comparator.nullsFirst(Instant::compareTo)));
            String previous = null;
            for (FunnelEvent event : ordered) {
                String nodeId = nodeId(event);
                labels.putIfAbsent(nodeId, nodeLabel(event));
                nodeSessions.computeIfAbsent(nodeId, k -> new HashSet<>()).add(entry.getKey());
                if (previous != null) {
                    edgeWeights.computeIfAbsent(List.of(previous, nodeId), k -> new long[1])[0]++;
                }
                previous = nodeId;
            }
        }

        List<FlowNode> nodes = new ArrayList<>(nodeSessions.size());
        for (Map.Entry<String, Set<String>> entry : nodeSessions.entrySet()) {
            nodes.add(new FlowNode(entry.getKey(), labels.get(entry.getKey()), entry.getValue().size()));
        }
        nodes.sort(Comparator.comparingLong(FlowNode::count).reversed());

        List<FlowEdge> edges = new ArrayList<>(edgeWeights.size());
        for (Map.Entry<List<String>, long[]> entry : edgeWeights.entrySet()) {
            edges.add(new FlowEdge(entry.getKey().get(0), entry.getKey().get(1), entry.getValue()[0]));
        }
        edges.sort(Comparator.comparingLong(FlowEdge::weight).reversed());

        return new FlowGraph(List.copyOf(nodes), List.copyOf(edges), metrics(sessions));
    }

    FlowMetrics metrics(Collection<FunnelSession> sessions) {
        long total = sessions.size();
        long converted = sessions.stream().filter(FunnelSession::converted).count();
        double conversionRate = Percentages.percent(converted, total);
        return new FlowMetrics(
                total,
                converted,
                Percentages.round(conversionRate, 2),
                Percentages.round(100.0d - conversionRate, 2));
    }

    static String nodeId(FunnelEvent event) {
        return firstPresent(event.pagePath(), event.eventName());
    }

    static String nodeLabel(FunnelEvent event) {
        return firstPresent(event.pageTitle(), event.pagePath(), event.eventName());
    }

    private static String firstPresent(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
