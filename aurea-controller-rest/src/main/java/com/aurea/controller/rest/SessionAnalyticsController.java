package com.aurea.controller.rest;

import com.aurea.service.core.bucket.SeriesFill;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.query.session.DeviceAnalyticsResult;
import com.aurea.service.core.query.session.GeographyAnalyticsResult;
import com.aurea.service.core.query.session.PerformanceResult;
import com.aurea.service.core.query.session.SessionAnalyticsService;
import com.aurea.service.core.query.session.SessionsTrendResult;
import com.aurea.service.core.query.vitals.WebVitalsService;
import com.aurea.service.core.query.vitals.WebVitalsStatsResult;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/funnels/{funnelId}/analytics", produces = MediaType.APPLICATION_JSON_VALUE)
public class SessionAnalyticsController {

    private final SessionAnalyticsService sessionService;
    private final WebVitalsService webVitalsService;
    private final TimeRangeResolver rangeResolver;

    public SessionAnalyticsController(
            SessionAnalyticsService sessionService,
            WebVitalsService webVitalsService,
            TimeRangeResolver rangeResolver) {
        this.sessionService = sessionService;
        this.webVitalsService = webVitalsService;
        this.rangeResolver = rangeResolver;
    }

    @GetMapping("/sessions/trend")
    public SessionsTrendResult sessionsTrend(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "granularity", required = false) String granularity,
            @RequestParam(value = "fill", required = false) String fill) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        return sessionService.sessionsTrend(
                funnelId, window, AnalyticsParams.granularity(granularity), SeriesFill.fromValue(fill));
    }

    @GetMapping("/devices")
    public DeviceAnalyticsResult devices(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to) {
        return sessionService.deviceAnalytics(funnelId, rangeResolver.resolve(range, from, to));
    }

    @GetMapping("/geography")
    public GeographyAnalyticsResult geography(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to) {
        return sessionService.geographyAnalytics(funnelId, rangeResolver.resolve(range, from, to));
    }

    @GetMapping("/performance")
    public PerformanceResult performance(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to) {
        return sessionService.performance(funnelId, rangeResolver.resolve(range, from, to));
    }

    @GetMapping("/web-vitals/stats")
    public WebVitalsStatsResult webVitalsStats(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to) {
        return webVitalsService.stats(funnelId, rangeResolver.resolve(range, from, to));
    }
}
