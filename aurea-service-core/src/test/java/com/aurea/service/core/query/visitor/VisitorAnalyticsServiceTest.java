package com.aurea.service.core.query.visitor;

import static com.aurea.service.core.support.Fixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aurea.service.core.api.FunnelNotFoundException;
import com.aurea.service.core.api.VisitorNotFoundException;
import com.aurea.service.core.lifecycle.LifecycleClassifier;
import com.aurea.service.core.lifecycle.VisitorLifecycleService;
import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.model.LifecycleStage;
import com.aurea.service.core.model.VisitorProfile;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.InMemoryFunnelRepository;
import com.aurea.service.core.repo.InMemorySessionRepository;
import com.aurea.service.core.repo.InMemoryVisitorProfileRepository;
import com.aurea.service.core.repo.VisitorProfileFilter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VisitorAnalyticsServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private final InMemoryFunnelRepository funnels = new InMemoryFunnelRepository();
    private final InMemoryVisitorProfileRepository profiles = new InMemoryVisitorProfileRepository();
    private final InMemorySessionRepository sessions = new InMemorySessionRepository();
    private final VisitorAnalyticsService service = new VisitorAnalyticsService(
            new FunnelLookup(funnels),
            profiles,
            sessions,
            new VisitorLifecycleService(profiles, new LifecycleClassifier(Clock.fixed(NOW, ZoneOffset.UTC))));

    private UUID funnelId;

    @BeforeEach
    void setUp() {
        funnelId = funnels.add("retention");
        profiles.add(funnelId, profile("v1", "Alice", "user-1", 3, NOW.minus(Duration.ofHours(1))));
        profiles.add(funnelId, profile("v2", "Bob", null, 1, NOW.minus(Duration.ofHours(2))));
        profiles.add(funnelId, profile("v3", "Carol", null, 6, NOW.minus(Duration.ofHours(3))));
        profiles.add(funnelId, profile("v4", "Dave", null, 1, NOW.minus(Duration.ofHours(4))));
        sessions.add(
                funnelId,
                session("sa").visitor("v1").startedAt(NOW.minus(Duration.ofHours(5)))
                        .engagementRate(80.0).vitals(null, 90).converted(40.0)
                        .build(),
                session("sb").visitor("v1").startedAt(NOW.minus(Duration.ofHours(1)))
                        .device("mobile", "Safari", "iOS").geography("NL", "Netherlands", "Utrecht")
                        .build());
    }

    @Test
    void pagesMostRecentFirstWithKeysetCursor() {
        VisitorProfilesPage first = service.profiles(funnelId, null, null, 2);

        assertThat(first.items()).extracting(item -> item.profile().id()).containsExactly("v1", "v2");
        assertThat(first.nextCursor()).isEqualTo("v2");

        VisitorProfilesPage second = service.profiles(funnelId, null, first.nextCursor(), 2);

        assertThat(second.items()).extracting(item -> item.profile().id()).containsExactly("v3", "v4");
        assertThat(second.nextCursor()).isNull();
    }

    @Test
    void itemsCarryLatestSessionContext() {
        VisitorProfilesPage page = service.profiles(funnelId, VisitorProfileFilter.none(), null, 10);

        assertThat(page.items().get(0).lastSession())
                .isEqualTo(new VisitorProfilesPage.LastSession("NL", "Netherlands", "Utrecht", "mobile", "Safari"));
        assertThat(page.items().get(1).lastSession()).isNull();
    }

    @Test
    void listingClassifiesProfilesBeforeFiltering() {
        VisitorProfilesPage loyal = service.profiles(
                funnelId, new VisitorProfileFilter(LifecycleStage.LOYAL, null, null), null, 10);

        assertThat(loyal.items()).extracting(item -> item.profile().id()).containsExactly("v3");
        assertThat(profiles.get("v1").lifecycleStage()).isEqualTo(LifecycleStage.RETURNING);
        assertThat(profiles.get("v2").lifecycleStage()).isEqualTo(LifecycleStage.NEW);
    }

    @Test
    void identityAndSearchFiltersCombine() {
        VisitorProfilesPage identified =
                service.profiles(funnelId, new VisitorProfileFilter(null, true, null), null, 10);
        VisitorProfilesPage searched =
                service.profiles(funnelId, new VisitorProfileFilter(null, false, "CAR"), null, 10);

        assertThat(identified.items()).extracting(item -> item.profile().id()).containsExactly("v1");
        assertThat(searched.items()).extracting(item -> item.profile().id()).containsExactly("v3");
    }

    @Test
    void detailAveragesOverAllSessions() {
        VisitorProfileDetail detail = service.profile(funnelId, "v1");

        assertThat(detail.sessions()).extracting(FunnelSession::sessionId).containsExactly("sb", "sa");
        assertThat(detail.totalSessions()).isEqualTo(2);
        assertThat(detail.totalConversions()).isEqualTo(1);
        assertThat(detail.totalRevenue()).isEqualTo(40.0);
        assertThat(detail.avgEngagementRate()).isEqualTo(40.0);
        assertThat(detail.avgExperienceScore()).isEqualTo(45.0);
    }

    @Test
    void detailClassifiesAnUnsetProfile() {
        VisitorProfileDetail detail = service.profile(funnelId, "v1");

        assertThat(detail.profile().lifecycleStage()).isEqualTo(LifecycleStage.RETURNING);
        assertThat(profiles.get("v1").lifecycleStage()).isEqualTo(LifecycleStage.RETURNING);
    }

    @Test
    void visitorOfAnotherFunnelIsNotFound() {
        UUID otherFunnel = funnels.add("checkout");
        profiles.add(otherFunnel, profile("v9", "Erin", null, 2, NOW.minus(Duration.ofHours(1))));

        assertThatThrownBy(() -> service.profile(funnelId, "v9"))
                .isInstanceOf(VisitorNotFoundException.class)
                .hasMessageContaining("v9");
        assertThat(service.profile(otherFunnel, "v9").profile().id()).isEqualTo("v9");
    }

    @Test
    void missingVisitorOrFunnelIsNotFound() {
        assertThatThrownBy(() -> service.profile(funnelId, "ghost")).isInstanceOf(VisitorNotFoundException.class);
        assertThatThrownBy(() -> service.profiles(UUID.randomUUID(), null, null, 10))
                .isInstanceOf(FunnelNotFoundException.class);
    }

    private static VisitorProfile profile(String id, String name, String userId, int sessions, Instant lastSeen) {
        return new VisitorProfile(id, name, userId, lastSeen.minus(Duration.ofDays(2)), lastSeen, sessions, 0, null);
    }
}
