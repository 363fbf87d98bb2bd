package com.aurea.controller.rest;

import com.aurea.service.core.config.AnalyticsProperties;
import com.aurea.service.core.query.visitor.VisitorAnalyticsService;
import com.aurea.service.core.query.visitor.VisitorProfileDetail;
import com.aurea.service.core.query.visitor.VisitorProfilesPage;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/funnels/{funnelId}/analytics/visitors", produces = MediaType.APPLICATION_JSON_VALUE)
public class VisitorController {

    private final VisitorAnalyticsService visitorService;
    private final AnalyticsProperties properties;

    public VisitorController(VisitorAnalyticsService visitorService, AnalyticsProperties properties) {
        this.visitorService = visitorService;
        this.properties = properties;
    }

    @GetMapping
    public VisitorProfilesPage profiles(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "lifecycleStage", required = false) String lifecycleStage,
            @RequestParam(value = "hasIdentified", required = false) Boolean hasIdentified,
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "cursor", required = false) String cursor,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return visitorService.profiles(
                funnelId,
                AnalyticsParams.visitorFilter(lifecycleStage, hasIdentified, search),
                cursor,
                properties.getLimits().resolve(limit));
    }

    @GetMapping("/{visitorId}")
    public VisitorProfileDetail profile(
            @PathVariable("funnelId") UUID funnelId, @PathVariable("visitorId") String visitorId) {
        return visitorService.profile(funnelId, visitorId);
    }
}
