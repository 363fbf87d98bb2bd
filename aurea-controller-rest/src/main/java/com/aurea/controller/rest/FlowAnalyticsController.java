package com.aurea.controller.rest;

import com.aurea.service.core.flow.FlowEventFilter;
import com.aurea.service.core.flow.FlowGraph;
import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.query.flow.FlowAnalyticsService;
import com.aurea.service.core.query.flow.SessionJourneyResult;
import com.aurea.service.core.stage.StageFlowResult;
import java.util.UUID;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/funnels/{funnelId}/analytics", produces = MediaType.APPLICATION_JSON_VALUE)
public class FlowAnalyticsController {

    private final FlowAnalyticsService flowService;
    private final TimeRangeResolver rangeResolver;

    public FlowAnalyticsController(FlowAnalyticsService flowService, TimeRangeResolver rangeResolver) {
        this.flowService = flowService;
        this.rangeResolver = rangeResolver;
    }

    @GetMapping("/flow")
    public FlowGraph funnelFlow(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "eventFilter", required = false) String eventFilter) {
        TimeWindow window = rangeResolver.resolve(range, from, to);
        return flowService.funnelFlow(funnelId, window, FlowEventFilter.fromValue(eventFilter));
    }

    @GetMapping("/stage-flow")
    public StageFlowResult stageFlow(
            @PathVariable("funnelId") UUID funnelId,
            @RequestParam(value = "range", required = false) String range,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to) {
        return flowService.stageFlow(funnelId, rangeResolver.resolve(range, from, to));
    }

    @GetMapping("/sessions/{sessionId}/journey")
    public SessionJourneyResult sessionJourney(
            @PathVariable("funnelId") UUID funnelId, @PathVariable("sessionId") String sessionId) {
        return flowService.sessionJourney(funnelId, sessionId);
    }
}
