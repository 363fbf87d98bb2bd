package com.aurea.service.core.query.session;

import static com.aurea.service.core.support.Fixtures.T0;
import static com.aurea.service.core.support.Fixtures.event;
import static com.aurea.service.core.support.Fixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.aurea.service.core.api.FunnelNotFoundException;
import com.aurea.service.core.attribution.AttributionResolver;
import com.aurea.service.core.bucket.BucketGranularity;
import com.aurea.service.core.bucket.SeriesFill;
import com.aurea.service.core.bucket.TimeBucketer;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.model.WebVitals;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.InMemoryEventRepository;
import com.aurea.service.core.repo.InMemoryFunnelRepository;
import com.aurea.service.core.repo.InMemorySessionRepository;
import java.time.Duration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionAnalyticsServiceTest {

    private static final TimeWindow DAY = new TimeWindow(T0, T0.plus(Duration.ofHours(24)));

    private final InMemoryFunnelRepository funnels = new InMemoryFunnelRepository();
    private final InMemorySessionRepository sessions = new InMemorySessionRepository();
    private final InMemoryEventRepository events = new InMemoryEventRepository();
    private final SessionAnalyticsService service = new SessionAnalyticsService(
            new FunnelLookup(funnels), sessions, events, new AttributionResolver(), TimeBucketer.utc());

    private UUID funnelId;

    @BeforeEach
    void setUp() {
        funnelId = funnels.add("signup");
    }

    @Test
    void trendBucketsHourlyForOneDayWindow() {
        sessions.add(
                funnelId,
                session("s1").pageViews(3).duration(45, 30).vitals(null, 80).converted(20.0).build(),
                session("s2").startedAt(T0.plus(Duration.ofMinutes(10))).pageViews(1).duration(5, 5).build(),
                session("s3").startedAt(T0.plus(Duration.ofHours(2))).pageViews(2).duration(700, 400).vitals(null, 60).build());

        SessionsTrendResult result = service.sessionsTrend(funnelId, DAY, null);

        assertThat(result.interval()).isEqualTo("hour");
        assertThat(result.timeSeries())
                .containsExactly(
                        new SessionsTrendResult.Point("2025-03-02T00:00:00Z", "Mar 2 0:00", 2, 4, 1, 20.0, 25, 80),
                        new SessionsTrendResult.Point("2025-03-02T02:00:00Z", "Mar 2 2:00", 1, 2, 0, 0.0, 700, 60));
        assertThat(result.totalSessions()).isEqualTo(3);
        assertThat(result.totalConversions()).isEqualTo(1);
        assertThat(result.totalRevenue()).isEqualTo(20.0);
        assertThat(result.avgPageViews()).isEqualTo(2);
        assertThat(result.avgDuration()).isEqualTo(250);
        assertThat(result.avgExperienceScore()).isEqualTo(70);
    }

    @Test
    void durationDistributionCoversEveryBand() {
        sessions.add(
                funnelId,
                session("s1").duration(45, 30).build(),
                session("s2").duration(5, 5).build(),
                session("s3").duration(700, 400).build(),
                session("s4").build());

        SessionsTrendResult result = service.sessionsTrend(funnelId, DAY, BucketGranularity.D1);

        assertThat(result.interval()).isEqualTo("day");
        assertThat(result.durationDistribution())
                .extracting(
                        SessionsTrendResult.DurationBucket::range,
                        SessionsTrendResult.DurationBucket::maxSeconds,
                        SessionsTrendResult.DurationBucket::count)
                .containsExactly(
                        tuple("0-30s", 30, 2L),
                        tuple("30s-1m", 60, 1L),
                        tuple("1-2m", 120, 0L),
                        tuple("2-5m", 300, 0L),
                        tuple("5-10m", 600, 0L),
                        tuple("10m+", null, 1L));
    }

    @Test
    void deviceRollupsKeepFirstSeenOrderOnTies() {
        sessions.add(
                funnelId,
                session("s1").device("mobile", "Safari", "iOS").pageViews(2).converted(10.0).build(),
                session("s2").device("mobile", "Chrome", "Android").build(),
                session("s3").device("desktop", "Chrome", "macOS").build(),
                session("s4").build());

        DeviceAnalyticsResult result = service.deviceAnalytics(funnelId, DAY);

        assertThat(result.deviceTypes())
                .extracting(DeviceAnalyticsResult.Row::name, DeviceAnalyticsResult.Row::sessions)
                .containsExactly(tuple("mobile", 2L), tuple("desktop", 1L), tuple("Unknown", 1L));
        assertThat(result.deviceTypes().get(0))
                .isEqualTo(new DeviceAnalyticsResult.Row("mobile", 2, 1, 10.0, 2, 50.0, 50.0));
        assertThat(result.browsers())
                .extracting(DeviceAnalyticsResult.Row::name)
                .containsExactly("Chrome", "Safari", "Unknown");
        assertThat(result.totalSessions()).isEqualTo(4);
        assertThat(result.totalConversions()).isEqualTo(1);
    }

    @Test
    void unknownCountriesBorrowEventGeographyInOneRead() {
        sessions.add(
                funnelId,
                session("s1").geography("US", "United States", "Austin").converted(50.0).build(),
                session("s2").build(),
                session("s3").geography("US", "United States", null).build(),
                session("s4").geography("Unknown", null, null).build());
        events.add(
                funnelId,
                event("e1", "s2").geography("DE", "Germany", "Berlin").at(T0.plusSeconds(30)).build(),
                event("e2", "s2").at(T0.plusSeconds(60)).build());

        GeographyAnalyticsResult result = service.geographyAnalytics(funnelId, DAY);

        assertThat(events.geoSightingReads()).isEqualTo(1);
        assertThat(result.countries())
                .extracting(
                        GeographyAnalyticsResult.CountryRow::countryCode,
                        GeographyAnalyticsResult.CountryRow::countryName,
                        GeographyAnalyticsResult.CountryRow::sessions,
                        GeographyAnalyticsResult.CountryRow::percentage)
                .containsExactly(
                        tuple("US", "United States", 2L, 50.0),
                        tuple("DE", "Germany", 1L, 25.0),
                        tuple("Unknown", "Unknown", 1L, 25.0));
        assertThat(result.cities())
                .containsExactly(
                        new GeographyAnalyticsResult.CityRow("Austin", "US", "United States", 1, 1, 25.0),
                        new GeographyAnalyticsResult.CityRow("Berlin", "DE", "Germany", 1, 0, 25.0));
        assertThat(result.totalRevenue()).isEqualTo(50.0);
    }

    @Test
    void knownGeographySkipsEventRead() {
        sessions.add(funnelId, session("s1").geography("FR", "France", "Paris").build());

        GeographyAnalyticsResult result = service.geographyAnalytics(funnelId, DAY);

        assertThat(events.geoSightingReads()).isZero();
        assertThat(result.countries()).singleElement().extracting(GeographyAnalyticsResult.CountryRow::countryCode)
                .isEqualTo("FR");
    }

    @Test
    void zeroFilledTrendCoversEveryHourOfTheWindow() {
        sessions.add(
                funnelId,
                session("s1").startedAt(T0.plus(Duration.ofMinutes(70))).duration(60, 60).build(),
                session("s2").startedAt(T0.plus(Duration.ofHours(5))).converted(9.0).build());

        SessionsTrendResult result = service.sessionsTrend(funnelId, DAY, BucketGranularity.H1, SeriesFill.ZERO);

        assertThat(result.timeSeries()).hasSize(25);
        assertThat(result.timeSeries().get(0))
                .isEqualTo(new SessionsTrendResult.Point("2025-03-02T00:00:00Z", "Mar 2 0:00", 0, 0, 0, 0.0, 0, 0));
        assertThat(result.timeSeries()).extracting(SessionsTrendResult.Point::sessions)
                .filteredOn(count -> count > 0)
                .hasSize(2);
        assertThat(result.timeSeries().get(5).conversions()).isEqualTo(1);
        assertThat(result.totalSessions()).isEqualTo(2);
    }

    @Test
    void performanceAveragesOnlyMeasuredVitals() {
        sessions.add(
                funnelId,
                session("s1").device("mobile", "Safari", "iOS")
                        .vitals(new WebVitals(2000.0, 100.0, 0.1, null, 300.0), 90)
                        .build(),
                session("s2").device("mobile", "Chrome", "Android").build(),
                session("s3").device("desktop", "Chrome", "macOS")
                        .vitals(new WebVitals(1000.0, null, null, null, null), 71)
                        .build());

        PerformanceResult result = service.performance(funnelId, DAY);

        assertThat(result.overall())
                .isEqualTo(new PerformanceResult.Overall(1500.0, 100.0, 0.1, null, 300.0, 81L, 3));
        assertThat(result.byDevice())
                .containsExactly(
                        new PerformanceResult.DeviceRow("mobile", 2000.0, 100.0, 0.1, null, 300.0, 90L, 1),
                        new PerformanceResult.DeviceRow("desktop", 1000.0, null, null, null, null, 71L, 1));
    }

    @Test
    void deviceSessionCountOnlyIncludesScoredSessions() {
        sessions.add(
                funnelId,
                session("s1").device("tablet", "Safari", "iPadOS")
                        .vitals(new WebVitals(900.0, null, null, null, null), null)
                        .build(),
                session("s2").device("tablet", "Safari", "iPadOS").build(),
                session("s3").device("tablet", "Chrome", "Android").vitals(null, 0).build());

        PerformanceResult result = service.performance(funnelId, DAY);

        assertThat(result.overall().totalSessions()).isEqualTo(3);
        PerformanceResult.DeviceRow tablet = result.byDevice().get(0);
        assertThat(tablet.sessions()).isEqualTo(1);
        assertThat(tablet.avgExperienceScore()).isZero();
        assertThat(tablet.avgLcp()).isEqualTo(900.0);
    }

    @Test
    void performanceOfEmptyWindowHasNullAverages() {
        PerformanceResult result = service.performance(funnelId, DAY);

        assertThat(result.overall().avgLcp()).isNull();
        assertThat(result.overall().avgExperienceScore()).isNull();
        assertThat(result.byDevice()).isEmpty();
    }

    @Test
    void unknownFunnelIsRejected() {
        assertThatThrownBy(() -> service.deviceAnalytics(UUID.randomUUID(), DAY))
                .isInstanceOf(FunnelNotFoundException.class);
    }
}
