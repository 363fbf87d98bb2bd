package com.aurea.service.core.flow;

/** A page or event identity; {@code count} is the number of distinct sessions that reached it. */
public record FlowNode(String id, String label, long count) {}
