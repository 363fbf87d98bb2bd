package com.aurea.service.core.engagement;

import static com.aurea.service.core.support.Fixtures.event;
import static com.aurea.service.core.support.Fixtures.session;
import static org.assertj.core.api.Assertions.assertThat;

import com.aurea.service.core.model.FunnelEvent;
import com.aurea.service.core.model.FunnelSession;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EngagementScorerTest {

    private final EngagementScorer scorer = new EngagementScorer();

    @Test
    void sessionEngagementIsCappedAtOneHundred() {
        assertThat(EngagementScorer.sessionEngagement(500, 400)).isEqualTo(100.0);
        assertThat(EngagementScorer.sessionEngagement(30, 120)).isEqualTo(25.0);
        assertThat(EngagementScorer.sessionEngagement(30, 0)).isZero();
    }

    @Test
    void repeatedEventsInOneSessionWeighThatSessionOnce() {
        List<FunnelSession> sessions = List.of(
                session("s1").duration(100, 100).engagementRate(100.0).converted(50).build(),
                session("s2").duration(100, 20).engagementRate(20.0).build(),
                session("s3").duration(100, 90).build());
        List<FunnelEvent> events = List.of(
                event("e1", "s1").name("scroll").build(),
                event("e2", "s1").name("scroll").build(),
                event("e3", "s1").name("scroll").build(),
                event("e4", "s2").name("scroll").build(),
                event("e5", "s3").name("scroll").build(),
                event("e6", "s2").name("click").build());

        EngagementReport report = scorer.eventEngagement(sessions, events, 0);

        assertThat(report.totalSessions()).isEqualTo(2);
        assertThat(report.avgEngagement()).isEqualTo(60.0);
        assertThat(report.events()).extracting(EventEngagement::eventName).containsExactly("scroll", "click");
        EventEngagement scroll = report.events().get(0);
        assertThat(scroll.occurrences()).isEqualTo(4);
        assertThat(scroll.sessions()).isEqualTo(2);
        assertThat(scroll.avgEngagement()).isEqualTo(60.0);
        assertThat(scroll.avgDuration()).isEqualTo(100L);
        assertThat(scroll.avgActiveTime()).isEqualTo(60L);
        assertThat(scroll.conversions()).isEqualTo(1);
        assertThat(scroll.conversionRate()).isEqualTo(50.0);
        assertThat(scroll.revenue()).isEqualTo(50.0);
    }

    @Test
    void noMeasuredSessionsGivesEmptyReport() {
        EngagementReport report = scorer.eventEngagement(
                List.of(session("s1").build()), List.of(event("e1", "s1").build()), 10);

        assertThat(report.totalSessions()).isZero();
        assertThat(report.events()).isEmpty();
    }

    @Test
    void frequencyBucketsOmitEmptyRangesAndKeepFixedOrder() {
        List<FunnelEvent> events = new ArrayList<>();
        addOccurrences(events, "v1", 23);
        addOccurrences(events, "v2", 1);
        addOccurrences(events, "v3", 7);
        addOccurrences(events, "v4", 2);
        addOccurrences(events, "v5", 1);

        FrequencyDistribution distribution = scorer.frequencyDistribution(events, "signup");

        assertThat(distribution.totalVisitors()).isEqualTo(5);
        assertThat(distribution.totalEvents()).isEqualTo(34);
        assertThat(distribution.avgFrequency()).isEqualTo(6.8);
        assertThat(distribution.distribution()).extracting(FrequencyBucketCount::bucket)
                .containsExactly("1", "2", "6-10", "21+");
        assertThat(distribution.distribution()).extracting(FrequencyBucketCount::visitorCount)
                .containsExactly(2L, 1L, 1L, 1L);
        assertThat(distribution.distribution()).extracting(FrequencyBucketCount::totalEvents)
                .containsExactly(2L, 2L, 7L, 23L);
        assertThat(distribution.distribution().get(0).label()).isEqualTo("1x");
        assertThat(distribution.distribution().get(0).percentage()).isEqualTo(40.0);
    }

    @Test
    void identifiedUserIdTakesPrecedenceOverAnonymousId() {
        List<FunnelEvent> events = List.of(
                event("e1", "s1").name("signup").visitor("anon-1", "user-1").build(),
                event("e2", "s2").name("signup").visitor("anon-2", "user-1").build(),
                event("e3", "s3").name("signup").visitor("anon-3", null).build());

        FrequencyDistribution distribution = scorer.frequencyDistribution(events, "signup");

        assertThat(distribution.totalVisitors()).isEqualTo(2);
        assertThat(distribution.distribution()).extracting(FrequencyBucketCount::bucket).containsExactly("1", "2");
    }

    private static void addOccurrences(List<FunnelEvent> events, String visitor, int count) {
        for (int i = 0; i < count; i++) {
            events.add(event(visitor + "-" + i, "s-" + visitor)
                    .name("signup")
                    .visitor(visitor, null)
                    .build());
        }
    }
}
