package com.aurea.service.core.query.event;

import static com.aurea.service.core.support.Fixtures.event;
import static com.aurea.service.core.support.Fixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.aurea.service.core.engagement.EngagementReport;
import com.aurea.service.core.engagement.EngagementScorer;
import com.aurea.service.core.engagement.EventEngagement;
import com.aurea.service.core.engagement.FrequencyBucketCount;
import com.aurea.service.core.engagement.FrequencyDistribution;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.InMemoryEventRepository;
import com.aurea.service.core.repo.InMemoryFunnelRepository;
import com.aurea.service.core.repo.InMemorySessionRepository;
import com.aurea.service.core.support.Fixtures;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventBreakdownServiceTest {

    private static final TimeWindow WINDOW =
            new TimeWindow(Fixtures.T0.minus(Duration.ofDays(1)), Fixtures.T0.plus(Duration.ofDays(1)));

    private final InMemoryFunnelRepository funnels = new InMemoryFunnelRepository();
    private final InMemoryEventRepository events = new InMemoryEventRepository();
    private final InMemorySessionRepository sessions = new InMemorySessionRepository();
    private final EventBreakdownService service =
            new EventBreakdownService(new FunnelLookup(funnels), events, sessions, new EngagementScorer());

    private UUID funnelId;

    @BeforeEach
    void setUp() {
        funnelId = funnels.add("store");
        events.add(
                funnelId,
                event("e1", "s1").device("mobile", "Chrome", "120").geography("US", "United States", "Austin").build(),
                event("e2", "s1").device("mobile", "Chrome", "121").geography("US", null, null).build(),
                event("e3", "s2").name("purchase").conversion(30.0)
                        .device("desktop", "Chrome", "120")
                        .geography("DE", "Germany", "Berlin")
                        .property("plan", "pro")
                        .property("coupon", "")
                        .build(),
                event("e4", "s3").name("purchase").conversion(20.0)
                        .device("desktop", "Safari", "17")
                        .property("plan", "pro")
                        .build(),
                event("e5", "s3").name("purchase").conversion(10.0)
                        .device("mobile", "Chrome", "121")
                        .property("plan", "basic")
                        .property("coupon", "SPRING")
                        .build());
    }

    @Test
    void devicesWithoutEventNameCoverAllEvents() {
        EventDevicesResult result = service.devices(funnelId, WINDOW, null, 10);

        assertThat(result.eventName()).isEqualTo("All Events");
        assertThat(result.totalEvents()).isEqualTo(5);
        assertThat(result.totalDevices()).isEqualTo(2);
        assertThat(result.devices())
                .containsExactly(
                        new EventDevicesResult.DeviceRow("mobile", 3, 10.0, 60.0),
                        new EventDevicesResult.DeviceRow("desktop", 2, 50.0, 40.0));
    }

    @Test
    void devicesForOneEventRoundPercentagesToOneDecimal() {
        EventDevicesResult result = service.devices(funnelId, WINDOW, "purchase", 10);

        assertThat(result.eventName()).isEqualTo("purchase");
        assertThat(result.devices())
                .containsExactly(
                        new EventDevicesResult.DeviceRow("desktop", 2, 50.0, 66.7),
                        new EventDevicesResult.DeviceRow("mobile", 1, 10.0, 33.3));
    }

    @Test
    void browsersReportTopVersionFirstSeenOnTies() {
        EventBrowsersResult result = service.browsers(funnelId, WINDOW, "", 10);

        assertThat(result.totalBrowsers()).isEqualTo(2);
        assertThat(result.browsers())
                .containsExactly(
                        new EventBrowsersResult.BrowserRow("Chrome", 4, 40.0, 80.0, "120", 2),
                        new EventBrowsersResult.BrowserRow("Safari", 1, 20.0, 20.0, "17", 1));
    }

    @Test
    void geographyNamesCountriesByFirstSighting() {
        EventGeographyResult result = service.geography(funnelId, WINDOW, null, 10);

        assertThat(result.countries())
                .extracting(
                        EventGeographyResult.CountryRow::countryCode,
                        EventGeographyResult.CountryRow::countryName,
                        EventGeographyResult.CountryRow::count)
                .containsExactly(
                        tuple("US", "United States", 2L),
                        tuple("Unknown", "Unknown", 2L),
                        tuple("DE", "Germany", 1L));
        assertThat(result.cities())
                .containsExactly(
                        new EventGeographyResult.CityRow("Austin", "United States", 1, 20.0),
                        new EventGeographyResult.CityRow("Berlin", "Germany", 1, 20.0));
        assertThat(result.totalCountries()).isEqualTo(3);
        assertThat(result.totalCities()).isEqualTo(2);
    }

    @Test
    void propertiesBreakdownTreatsEmptyValuesAsUnknown() {
        PropertiesBreakdownResult result = service.propertiesBreakdown(funnelId, WINDOW, "purchase", 10);

        assertThat(result.totalEvents()).isEqualTo(3);
        assertThat(result.properties())
                .extracting(PropertiesBreakdownResult.Property::propertyKey)
                .containsExactly("plan", "coupon");
        assertThat(result.properties().get(0).breakdown())
                .containsExactly(
                        new PropertiesBreakdownResult.Value("pro", 2, 50.0, 66.7),
                        new PropertiesBreakdownResult.Value("basic", 1, 10.0, 33.3));
        assertThat(result.properties().get(1).breakdown())
                .extracting(PropertiesBreakdownResult.Value::value, PropertiesBreakdownResult.Value::count)
                .containsExactly(tuple("Unknown", 2L), tuple("SPRING", 1L));
    }

    @Test
    void propertiesBreakdownCountsValuesAfterLimit() {
        PropertiesBreakdownResult result = service.propertiesBreakdown(funnelId, WINDOW, "purchase", 1);

        assertThat(result.properties()).allSatisfy(property -> assertThat(property.totalValues()).isEqualTo(1));
    }

    @Test
    void payloadAnalysesRequireEventName() {
        assertThatThrownBy(() -> service.propertiesBreakdown(funnelId, WINDOW, null, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("eventName");
        assertThatThrownBy(() -> service.frequency(funnelId, WINDOW, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void frequencyCountsOccurrencesPerVisitor() {
        FrequencyDistribution result = service.frequency(funnelId, WINDOW, "purchase");

        assertThat(result.totalVisitors()).isEqualTo(2);
        assertThat(result.totalEvents()).isEqualTo(3);
        assertThat(result.avgFrequency()).isEqualTo(1.5);
        assertThat(result.distribution())
                .extracting(FrequencyBucketCount::bucket, FrequencyBucketCount::visitorCount)
                .containsExactly(tuple("1", 1L), tuple("2", 1L));
    }

    @Test
    void engagementUsesOnlySessionsWithMeasuredRate() {
        sessions.add(
                funnelId,
                session("s1").duration(100, 50).engagementRate(50.0).build(),
                session("s2").duration(100, 90).engagementRate(90.0).converted(30.0).build(),
                session("s3").duration(100, 100).build());

        EngagementReport report = service.engagement(funnelId, WINDOW, 10);

        assertThat(report.totalSessions()).isEqualTo(2);
        assertThat(report.avgEngagement()).isEqualTo(70.0);
        assertThat(report.events())
                .extracting(EventEngagement::eventName, EventEngagement::occurrences, EventEngagement::avgEngagement)
                .containsExactly(tuple("purchase", 1L, 90.0), tuple("page_view", 2L, 50.0));
        assertThat(report.events().get(0).conversionRate()).isEqualTo(100.0);
        assertThat(report.events().get(0).revenue()).isEqualTo(30.0);
    }

    @Test
    void engagementWithoutMeasuredSessionsIsEmpty() {
        EngagementReport report = service.engagement(funnelId, WINDOW, 10);

        assertThat(report).isEqualTo(new EngagementReport(0, 0.0, List.of()));
    }
}
