package com.aurea.controller.rest;

import com.aurea.service.core.bucket.SeriesFill;
import com.aurea.service.core.config.AnalyticsProperties;
import com.aurea.service.core.engagement.EngagementReport;
import com.aurea.service.core.engagement.FrequencyDistribution;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.query.event.CategoryBreakdownResult;
import com.aurea.service.core.query.event.CategoryTrendResult;
import com.aurea.service.core.query.event.EventAnalyticsService;
import com.aurea.service.core.query.event.EventBreakdownService;
import com.aurea.service.core.query.event.EventBrowsersResult;
import com.aurea.service.core.query.event.EventDevicesResult;
import com.aurea.service.core.query.event.EventGeographyResult;
import com.aurea.service.core.query.event.EventsOverTimeResult;
import com.aurea.service.core.query.event.EventsTrendResult;
import com.aurea.service.core.query.event.MicroConversionService;
import com.aurea.service.core.query.event.PropertiesBreakdownResult;
import com.aurea.service.core.query.event.PurchaseHeatmapResult;
import com.aurea.service.core.query.event.TopMicroConversion;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/funnels/{funnelId}/analytics", produces = MediaType.APPLICATION_JSON_VALUE)
public class EventAnalyticsController {
    private static final Logger log = LoggerFactory.getLogger(EventAnalyticsController.class);

    private final EventAnalyticsService eventService;
    private final EventBreakdownService breakdownService;
    private final MicroConversionService microConversionService;
    private final TimeRangeResolver rangeResolver;
    private final AnalyticsProperties properties;

    public EventAnalyticsController(
            EventAnalyticsService eventService,
            EventBreakdownService breakdownService,
            MicroConversionService microConversionService,
            TimeRangeResolver rangeResolver,
            AnalyticsProperties properties) {
        this.eventService = eventService;
        this.breakdownService = breakdownService;
        this.microConversionService = microConversionService;
        this.rangeResolver = rangeResolver;
        this.properties = properties;
    }

    @GetMapping("/events/trend")
    public EventsTrendResult eventsTrend(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "granularity", required = false) String granularity,
            @RequestParam(value = "fill", required = false) String fill) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        return eventService.eventsTrend(
                funnelId, window, AnalyticsParams.granularity(granularity), SeriesFill.fromValue(fill));
    }

    @GetMapping("/events/over-time")
    public EventsOverTimeResult eventsOverTime(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "granularity", required = false) String granularity,
            @RequestParam(value = "fill", required = false) String fill) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        return eventService.eventsOverTime(
                funnelId, window, AnalyticsParams.granularity(granularity), SeriesFill.fromValue(fill));
    }

    @GetMapping("/events/category-trend")
    public CategoryTrendResult categoryTrend(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "granularity", required = false) String granularity) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        return eventService.categoryTrend(funnelId, window, AnalyticsParams.granularity(granularity));
    }

    @GetMapping("/events/purchase-heatmap")
    public PurchaseHeatmapResult purchaseHeatmap(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to) {
        return eventService.purchaseHeatmap(funnelId, rangeResolver.resolve(range, from, to));
    }

    @GetMapping("/events/devices")
    public EventDevicesResult eventDevices(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "eventName", required = false) String eventName,
            @RequestParam(value = "limit", required = false) Integer limit) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        return breakdownService.devices(funnelId, window, eventName, properties.getLimits().resolve(limit));
    }

    @GetMapping("/events/browsers")
    public EventBrowsersResult eventBrowsers(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "eventName", required = false) String eventName,
            @RequestParam(value = "limit", required = false) Integer limit) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        return breakdownService.browsers(funnelId, window, eventName, properties.getLimits().resolve(limit));
    }

    @GetMapping("/events/geography")
    public EventGeographyResult eventGeography(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "eventName", required = false) String eventName,
            @RequestParam(value = "limit", required = false) Integer limit) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        return breakdownService.geography(funnelId, window, eventName, properties.getLimits().resolve(limit));
    }

    @GetMapping("/events/properties")
    public PropertiesBreakdownResult propertiesBreakdown(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam("eventName") String eventName,
            @RequestParam(value = "limit", required = false) Integer limit) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        if (log.isDebugEnabled()) {
            log.debug("GET properties breakdown: funnel={}, eventName={}, window={}", funnelId, eventName, window);
        }
        return breakdownService.propertiesBreakdown(
                funnelId, window, eventName, properties.getLimits().resolve(limit));
    }

    @GetMapping("/events/frequency")
    public FrequencyDistribution frequency(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam("eventName") String eventName) {
        return breakdownService.frequency(funnelId, rangeResolver.resolve(range, from, to), eventName);
    }

    @GetMapping("/events/engagement")
    public EngagementReport engagement(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "limit", required = false) Integer limit) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        return breakdownService.engagement(funnelId, window, properties.getLimits().resolve(limit));
    }

    @GetMapping("/micro-conversions/categories")
    public CategoryBreakdownResult categoryBreakdown(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to) {
        return microConversionService.categoryBreakdown(funnelId, rangeResolver.resolve(range, from, to));
    }

    @GetMapping("/micro-conversions/top")
    public List<TopMicroConversion> topMicroConversions(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "limit", required = false) Integer limit) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        return microConversionService.topMicroConversions(funnelId, window, properties.getLimits().resolve(limit));
    }
}
