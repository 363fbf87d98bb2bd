package com.aurea.service.core.flow;

import static com.aurea.service.core.support.Fixtures.T0;
import static com.aurea.service.core.support.Fixtures.event;
import static com.aurea.service.core.support.Fixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aurea.service.core.model.FunnelEvent;
import java.util.List;
import org.junit.jupiter.api.Test;

class FlowGraphBuilderTest {

    private final FlowGraphBuilder builder = new FlowGraphBuilder();

    @Test
    void revisitsCountOncePerNodeButEveryTransitionCounts() {
        List<FunnelEvent> events = List.of(
                event("e3", "s1").page("/", "Home").at(T0.plusSeconds(20)).build(),
                event("e1", "s1").page("/", "Home").at(T0).build(),
                event("e2", "s1").page("/pricing", "Pricing").at(T0.plusSeconds(10)).build());

        FlowGraph graph = builder.build(events, List.of(session("s1").build()));

        assertThat(graph.nodes()).extracting(FlowNode::id).containsExactly("/", "/pricing");
        assertThat(graph.nodes().get(0).count()).isEqualTo(1);
        assertThat(graph.nodes().get(0).label()).isEqualTo("Home");
        assertThat(graph.edges()).containsExactlyInAnyOrder(
                new FlowEdge("/", "/pricing", 1), new FlowEdge("/pricing", "/", 1));
    }

    @Test
    void nodesAndEdgesSortedByWeight() {
        List<FunnelEvent> events = List.of(
                event("a1", "s1").page("/", null).at(T0).build(),
                event("a2", "s1").page("/signup", null).at(T0.plusSeconds(5)).build(),
                event("b1", "s2").page("/", null).at(T0).build(),
                event("b2", "s2").page("/signup", null).at(T0.plusSeconds(5)).build(),
                event("c1", "s3").page("/blog", null).at(T0).build(),
                event("c2", "s3").page("/", null).at(T0.plusSeconds(5)).build());

        FlowGraph graph = builder.build(
                events, List.of(session("s1").converted(10).build(), session("s2").build(), session("s3").build()));

        assertThat(graph.nodes()).extracting(FlowNode::id).containsExactly("/", "/signup", "/blog");
        assertThat(graph.nodes()).extracting(FlowNode::label).containsExactly("/", "/signup", "/blog");
        assertThat(graph.edges().get(0)).isEqualTo(new FlowEdge("/", "/signup", 2));
        assertThat(graph.metrics().totalSessions()).isEqualTo(3);
        assertThat(graph.metrics().convertedSessions()).isEqualTo(1);
        assertThat(graph.metrics().conversionRate()).isEqualTo(33.33);
        assertThat(graph.metrics().dropOffRate()).isEqualTo(66.67);
    }

    @Test
    void eventsWithoutPathUseEventNameThenUnknown() {
        FunnelEvent named = event("e1", "s1").name("add_to_cart").at(T0).build();
        FunnelEvent bare = event("e2", "s1").name(" ").at(T0.plusSeconds(1)).build();

        assertThat(FlowGraphBuilder.nodeId(named)).isEqualTo("add_to_cart");
        assertThat(FlowGraphBuilder.nodeId(bare)).isEqualTo("Unknown");
    }

    @Test
    void emptyInputGivesEmptyGraphWithZeroMetrics() {
        FlowGraph graph = builder.build(List.of(), List.of());

        assertThat(graph.nodes()).isEmpty();
        assertThat(graph.edges()).isEmpty();
        assertThat(graph.metrics().conversionRate()).isZero();
        assertThat(graph.metrics().dropOffRate()).isEqualTo(100.0);
    }

    @Test
    void eventFilterParsesWireValues() {
        assertThat(FlowEventFilter.fromValue(null)).isEqualTo(FlowEventFilter.PAGE_VIEW);
        assertThat(FlowEventFilter.fromValue("all")).isEqualTo(FlowEventFilter.ALL);
        assertThatThrownBy(() -> FlowEventFilter.fromValue("clicks")).isInstanceOf(IllegalArgumentException.class);
    }
}
