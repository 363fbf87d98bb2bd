package com.aurea.service.core.flow;

import java.util.List;

public record FlowGraph(List<FlowNode> nodes, List<FlowEdge> edges, FlowMetrics metrics) {}
