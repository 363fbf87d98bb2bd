package com.aurea.controller.rest;

import com.aurea.service.core.config.AnalyticsProperties;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.query.traffic.AdPerformanceResult;
import com.aurea.service.core.query.traffic.AdPerformanceService;
import com.aurea.service.core.query.traffic.AttributionResult;
import com.aurea.service.core.query.traffic.OverviewResult;
import com.aurea.service.core.query.traffic.TrafficAnalyticsService;
import com.aurea.service.core.query.traffic.TrafficSourcesResult;
import com.aurea.service.core.query.traffic.UtmAnalyticsResult;
import com.aurea.service.core.query.traffic.UtmGroupBy;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/funnels/{funnelId}/analytics", produces = MediaType.APPLICATION_JSON_VALUE)
public class TrafficAnalyticsController {

    private final TrafficAnalyticsService trafficService;
    private final AdPerformanceService adPerformanceService;
    private final TimeRangeResolver rangeResolver;
    private final AnalyticsProperties properties;

    public TrafficAnalyticsController(
            TrafficAnalyticsService trafficService,
            AdPerformanceService adPerformanceService,
            TimeRangeResolver rangeResolver,
            AnalyticsProperties properties) {
        this.trafficService = trafficService;
        this.adPerformanceService = adPerformanceService;
        this.rangeResolver = rangeResolver;
        this.properties = properties;
    }

    @GetMapping("/overview")
    public OverviewResult overview(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to) {
        return trafficService.overview(funnelId, rangeResolver.resolve(range, from, to));
    }

    @GetMapping("/traffic-sources")
    public TrafficSourcesResult trafficSources(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "limit", required = false) Integer limit) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        return trafficService.trafficSources(funnelId, window, properties.getLimits().resolve(limit));
    }

    @GetMapping("/utm")
    public UtmAnalyticsResult utm(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "groupBy", required = false) String groupBy) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        return trafficService.utmAnalytics(funnelId, window, UtmGroupBy.fromValue(groupBy));
    }

    @GetMapping("/attribution")
    public AttributionResult attribution(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to) {
        return trafficService.attribution(funnelId, rangeResolver.resolve(range, from, to));
    }

    @GetMapping("/ad-performance")
    public AdPerformanceResult adPerformance(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to) {
        return adPerformanceService.adPerformance(funnelId, rangeResolver.resolve(range, from, to));
    }
}
