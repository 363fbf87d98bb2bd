package com.aurea.service.core.flow;

/** Directed transition between two node ids; {@code weight} counts observed session transitions. */
public record FlowEdge(String source, String target, long weight) {}
