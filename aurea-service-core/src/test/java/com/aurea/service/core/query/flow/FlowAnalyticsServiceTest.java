package com.aurea.service.core.query.flow;

import static com.aurea.service.core.support.Fixtures.T0;
import static com.aurea.service.core.support.Fixtures.event;
import static com.aurea.service.core.support.Fixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aurea.service.core.api.FunnelNotFoundException;
import com.aurea.service.core.api.SessionNotFoundException;
import com.aurea.service.core.flow.FlowEdge;
import com.aurea.service.core.flow.FlowEventFilter;
import com.aurea.service.core.flow.FlowGraph;
import com.aurea.service.core.flow.FlowGraphBuilder;
import com.aurea.service.core.flow.FlowNode;
import com.aurea.service.core.model.StageEntry;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.InMemoryEventRepository;
import com.aurea.service.core.repo.InMemoryFunnelRepository;
import com.aurea.service.core.repo.InMemorySessionRepository;
import com.aurea.service.core.stage.StageDropOffCalculator;
import com.aurea.service.core.stage.StageFlowResult;
import com.aurea.service.core.stage.StageSnapshot;
import java.time.Duration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FlowAnalyticsServiceTest {

    private static final TimeWindow WINDOW = new TimeWindow(T0, T0.plus(Duration.ofDays(1)));

    private final InMemoryFunnelRepository funnels = new InMemoryFunnelRepository();
    private final InMemorySessionRepository sessions = new InMemorySessionRepository();
    private final InMemoryEventRepository events = new InMemoryEventRepository();
    private final FlowAnalyticsService service = new FlowAnalyticsService(
            new FunnelLookup(funnels), sessions, events, new FlowGraphBuilder(), new StageDropOffCalculator());

    private UUID funnelId;

    @BeforeEach
    void setUp() {
        funnelId = funnels.add("onboarding");
        sessions.add(
                funnelId,
                session("s1").stage("awareness").build(),
                session("s2").stage("awareness").build(),
                session("s3").stage("interest").build(),
                session("s4").stage("awareness").build(),
                session("s5").stage("interest").build(),
                session("s6").stage("purchase").converted(99.0)
                        .stageHistory(new StageEntry("awareness", T0), new StageEntry("purchase", T0.plusSeconds(90)))
                        .build(),
                session("s7").build());
        events.add(
                funnelId,
                event("e1", "s1").page("/", "Home").build(),
                event("e2", "s1").name("signup_click").at(T0.plusSeconds(5)).build(),
                event("e3", "s1").page("/pricing", "Pricing").at(T0.plusSeconds(10)).build());
    }

    @Test
    void pageViewFlowSkipsCustomEvents() {
        FlowGraph graph = service.funnelFlow(funnelId, WINDOW, FlowEventFilter.PAGE_VIEW);

        assertThat(graph.nodes()).extracting(FlowNode::id).containsExactlyInAnyOrder("/", "/pricing");
        assertThat(graph.edges()).containsExactly(new FlowEdge("/", "/pricing", 1));
        assertThat(graph.metrics().totalSessions()).isEqualTo(7);
    }

    @Test
    void allEventFlowRoutesThroughCustomEvents() {
        FlowGraph graph = service.funnelFlow(funnelId, WINDOW, FlowEventFilter.ALL);

        assertThat(graph.nodes()).extracting(FlowNode::id).containsExactlyInAnyOrder("/", "signup_click", "/pricing");
        assertThat(graph.edges())
                .containsExactlyInAnyOrder(
                        new FlowEdge("/", "signup_click", 1), new FlowEdge("signup_click", "/pricing", 1));
    }

    @Test
    void stageFlowIgnoresSessionsWithoutStage() {
        StageFlowResult result = service.stageFlow(funnelId, WINDOW);

        assertThat(result.stages()).extracting(StageSnapshot::stage).containsExactly("awareness", "interest", "purchase");
        assertThat(result.stages()).extracting(StageSnapshot::dropOffRate).containsExactly(0.0, 33.33, 50.0);
        assertThat(result.totalSessions()).isEqualTo(3);
        assertThat(result.finalConversions()).isEqualTo(1);
        assertThat(result.overallConversionRate()).isEqualTo("33.33");
    }

    @Test
    void journeyListsEventsInOrderWithStageHistory() {
        SessionJourneyResult journey = service.sessionJourney(funnelId, "s1");

        assertThat(journey.session().sessionId()).isEqualTo("s1");
        assertThat(journey.session().currentStage()).isEqualTo("awareness");
        assertThat(journey.events())
                .extracting(SessionJourneyResult.Step::eventId)
                .containsExactly("e1", "e2", "e3");
        assertThat(journey.events().get(0).pageTitle()).isEqualTo("Home");

        assertThat(service.sessionJourney(funnelId, "s6").stageHistory())
                .extracting(StageEntry::stage)
                .containsExactly("awareness", "purchase");
    }

    @Test
    void journeyOfMissingSessionIsNotFound() {
        assertThatThrownBy(() -> service.sessionJourney(funnelId, "nope"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void journeyOfSessionInAnotherFunnelIsNotFound() {
        UUID otherFunnel = funnels.add("other tenant");
        sessions.add(otherFunnel, session("foreign").stage("purchase").build());
        events.add(otherFunnel, event("f1", "foreign").page("/", "Home").build());

        assertThatThrownBy(() -> service.sessionJourney(funnelId, "foreign"))
                .isInstanceOf(SessionNotFoundException.class)
                .hasMessageContaining("foreign");
        assertThat(service.sessionJourney(otherFunnel, "foreign").events()).hasSize(1);
    }

    @Test
    void journeyChecksFunnelBeforeSession() {
        assertThatThrownBy(() -> service.sessionJourney(UUID.randomUUID(), "s1"))
                .isInstanceOf(FunnelNotFoundException.class);
    }
}
