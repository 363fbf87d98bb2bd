package com.aurea.controller.rest;

import com.aurea.service.core.query.dashboard.DashboardQueryService;
import com.aurea.service.core.query.dashboard.DashboardResult;
import com.aurea.service.core.query.dashboard.DashboardSection;
import java.util.List;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/funnels/{funnelId}/analytics", produces = MediaType.APPLICATION_JSON_VALUE)
public class DashboardController {

    private final DashboardQueryService dashboardService;
    private final TimeRangeResolver rangeResolver;

    public DashboardController(DashboardQueryService dashboardService, TimeRangeResolver rangeResolver) {
        this.dashboardService = dashboardService;
        this.rangeResolver = rangeResolver;
    }

    /** Omitting {@code sections} returns every section. */
    @GetMapping("/dashboard")
    public DashboardResult dashboard(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "sections", required = false) List<String> sections) {
        return dashboardService.dashboard(
                funnelId, rangeResolver.resolve(range, from, to), DashboardSection.parse(sections));
    }
}
