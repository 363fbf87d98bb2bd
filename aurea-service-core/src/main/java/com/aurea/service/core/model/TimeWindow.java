package com.aurea.service.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** Inclusive analysis window. */
public record TimeWindow(Instant from, Instant to) {

    public TimeWindow {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Time window end must not precede start");
        }
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(from) && !instant.isAfter(to);
    }

    public Duration length() {
        return Duration.between(from, to);
    }
}
