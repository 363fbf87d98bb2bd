package com.aurea.service.core.query.dashboard;

import com.aurea.service.core.api.AnalyticsNotFoundException;
import com.aurea.service.core.config.AnalyticsProperties;
import com.aurea.service.core.flow.FlowEventFilter;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.query.event.EventAnalyticsService;
import com.aurea.service.core.query.event.EventBreakdownService;
import com.aurea.service.core.query.event.MicroConversionService;
import com.aurea.service.core.query.flow.FlowAnalyticsService;
import com.aurea.service.core.query.session.SessionAnalyticsService;
import com.aurea.service.core.query.traffic.TrafficAnalyticsService;
import com.aurea.service.core.query.traffic.UtmGroupBy;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the requested analyses concurrently and joins them into one response. Each section uses its default
 * parameters. A missing funnel or session surfaces as not-found; any other failure fails the whole dashboard.
 */
@Service
public class DashboardQueryService {
    private static final Logger log = LoggerFactory.getLogger(DashboardQueryService.class);

    private final FunnelLookup funnelLookup;
    private final DashboardExecutor executor;
    private final AnalyticsProperties properties;
    private final TrafficAnalyticsService trafficService;
    private final SessionAnalyticsService sessionService;
    private final EventAnalyticsService eventService;
    private final EventBreakdownService breakdownService;
    private final MicroConversionService microConversionService;
    private final FlowAnalyticsService flowService;

    public DashboardQueryService(
            FunnelLookup funnelLookup,
            DashboardExecutor executor,
            AnalyticsProperties properties,
            TrafficAnalyticsService trafficService,
            SessionAnalyticsService sessionService,
            EventAnalyticsService eventService,
            EventBreakdownService breakdownService,
            MicroConversionService microConversionService,
            FlowAnalyticsService flowService) {
        this.funnelLookup = funnelLookup;
        this.executor = executor;
        this.properties = properties;
        this.trafficService = trafficService;
        this.sessionService = sessionService;
        this.eventService = eventService;
        this.breakdownService = breakdownService;
        this.microConversionService = microConversionService;
        this.flowService = flowService;
    }

    public DashboardResult dashboard(UUID funnelId, TimeWindow window, Set<DashboardSection> sections) {
        funnelLookup.requireFunnel(funnelId);
        Map<DashboardSection, CompletableFuture<Object>> futures = new LinkedHashMap<>();
        for (DashboardSection section : sections) {
            futures.put(section, executor.submit(analysis(section, funnelId, window)));
        }

        long timeoutSeconds = properties.getDashboard().getTimeoutSeconds();
        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0]))
                    .get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new IllegalStateException("Interrupted while building dashboard for funnel " + funnelId, ie);
        } catch (TimeoutException te) {
            cancelAll(futures);
            log.error("Dashboard timed out funnel={} sections={} timeoutSeconds={}", funnelId, sections, timeoutSeconds);
            throw new IllegalStateException("Dashboard timed out after " + timeoutSeconds + "s", te);
        } catch (ExecutionException ee) {
            cancelAll(futures);
            throw unwrap(funnelId, ee.getCause());
        }

        Map<String, Object> results = new LinkedHashMap<>();
        futures.forEach((section, future) -> results.put(section.wireValue(), future.join()));
        log.debug("Dashboard complete funnel={} sections={}", funnelId, results.keySet());
        return new DashboardResult(results);
    }

    private Supplier<Object> analysis(DashboardSection section, UUID funnelId, TimeWindow window) {
        int limit = properties.getLimits().getDefaultLimit();
        return switch (section) {
            case OVERVIEW -> () -> trafficService.overview(funnelId, window);
            case TRAFFIC_SOURCES -> () -> trafficService.trafficSources(funnelId, window, limit);
            case UTM -> () -> trafficService.utmAnalytics(funnelId, window, UtmGroupBy.SOURCE);
            case ATTRIBUTION -> () -> trafficService.attribution(funnelId, window);
            case SESSIONS_TREND -> () -> sessionService.sessionsTrend(funnelId, window, null);
            case EVENTS_TREND -> () -> eventService.eventsTrend(funnelId, window, null);
            case DEVICES -> () -> sessionService.deviceAnalytics(funnelId, window);
            case GEOGRAPHY -> () -> sessionService.geographyAnalytics(funnelId, window);
            case PERFORMANCE -> () -> sessionService.performance(funnelId, window);
            case FUNNEL_FLOW -> () -> flowService.funnelFlow(funnelId, window, FlowEventFilter.PAGE_VIEW);
            case STAGE_FLOW -> () -> flowService.stageFlow(funnelId, window);
            case CATEGORY_BREAKDOWN -> () -> microConversionService.categoryBreakdown(funnelId, window);
            case TOP_MICRO_CONVERSIONS -> () -> microConversionService.topMicroConversions(funnelId, window, limit);
            case ENGAGEMENT -> () -> breakdownService.engagement(funnelId, window, limit);
            case PURCHASE_HEATMAP -> () -> eventService.purchaseHeatmap(funnelId, window);
        };
    }

    private RuntimeException unwrap(UUID funnelId, Throwable cause) {
        if (cause instanceof AnalyticsNotFoundException notFound) {
            return notFound;
        }
        log.error("Dashboard analysis failed funnel={}", funnelId, cause);
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("Dashboard analysis failed for funnel " + funnelId, cause);
    }

    private static void cancelAll(Map<DashboardSection, CompletableFuture<Object>> futures) {
        futures.values().forEach(future -> future.cancel(true));
    }
}
