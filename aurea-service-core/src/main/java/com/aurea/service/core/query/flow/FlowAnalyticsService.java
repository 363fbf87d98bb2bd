package com.aurea.service.core.query.flow;

import com.aurea.service.core.api.SessionNotFoundException;
import com.aurea.service.core.flow.FlowEventFilter;
import com.aurea.service.core.flow.FlowGraph;
import com.aurea.service.core.flow.FlowGraphBuilder;
import com.aurea.service.core.model.FunnelEvent;
import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.EventFilter;
import com.aurea.service.core.repo.EventRepository;
import com.aurea.service.core.repo.SessionRepository;
import com.aurea.service.core.stage.StageDropOffCalculator;
import com.aurea.service.core.stage.StageFlowResult;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Journey analyses: page transitions, stage progression and single-session replays. */
@Service
public class FlowAnalyticsService {
    private static final Logger log = LoggerFactory.getLogger(FlowAnalyticsService.class);

    private final FunnelLookup funnelLookup;
    private final SessionRepository sessionRepository;
    private final EventRepository eventRepository;
    private final FlowGraphBuilder flowGraphBuilder;
    private final StageDropOffCalculator stageDropOffCalculator;

    public FlowAnalyticsService(
            FunnelLookup funnelLookup,
            SessionRepository sessionRepository,
            EventRepository eventRepository,
            FlowGraphBuilder flowGraphBuilder,
            StageDropOffCalculator stageDropOffCalculator) {
        this.funnelLookup = funnelLookup;
        this.sessionRepository = sessionRepository;
        this.eventRepository = eventRepository;
        this.flowGraphBuilder = flowGraphBuilder;
        this.stageDropOffCalculator = stageDropOffCalculator;
    }

    public FlowGraph funnelFlow(UUID funnelId, TimeWindow window, FlowEventFilter eventFilter) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelSession> sessions = sessionRepository.findInWindow(funnelId, window);
        EventFilter filter = eventFilter == FlowEventFilter.ALL ? EventFilter.all() : EventFilter.pageViews();
        List<FunnelEvent> events = eventRepository.findInWindow(funnelId, window, filter);
        FlowGraph graph = flowGraphBuilder.build(events, sessions);
        log.debug(
                "Funnel flow funnel={} events={} nodes={} edges={}",
                funnelId,
                events.size(),
                graph.nodes().size(),
                graph.edges().size());
        return graph;
    }

    public StageFlowResult stageFlow(UUID funnelId, TimeWindow window) {
        funnelLookup.requireFunnel(funnelId);
        List<FunnelSession> sessions = sessionRepository.findInWindow(funnelId, window);
        return stageDropOffCalculator.stageFlow(stageDropOffCalculator.countByCurrentStage(sessions));
    }

    public SessionJourneyResult sessionJourney(UUID funnelId, String sessionId) {
        funnelLookup.requireFunnel(funnelId);
        FunnelSession session = sessionRepository
                .findBySessionId(funnelId, sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        List<SessionJourneyResult.Step> steps = new ArrayList<>();
        for (FunnelEvent event : eventRepository.findBySessionId(funnelId, sessionId)) {
            steps.add(new SessionJourneyResult.Step(
                    event.eventId(),
                    event.eventName(),
                    event.eventCategory(),
                    event.eventDescription(),
                    event.microConversionType(),
                    event.microConversionValue(),
                    event.funnelStage(),
                    event.timestamp(),
                    event.pageUrl(),
                    event.pageTitle()));
        }
        SessionJourneyResult.Session summary = new SessionJourneyResult.Session(
                session.sessionId(),
                session.anonymousId(),
                session.startedAt(),
                session.endedAt(),
                session.currentStage(),
                session.converted(),
                session.conversionValue(),
                session.durationSeconds(),
                session.activeTimeSeconds(),
                session.engagementRate(),
                session.device().deviceType(),
                session.device().browserName(),
                session.geography().city(),
                session.geography().countryName());
        return new SessionJourneyResult(summary, List.copyOf(steps), session.stageHistory());
    }
}
