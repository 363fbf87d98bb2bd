package com.aurea.controller.rest;

import com.aurea.service.core.model.TimeWindow;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Turns request range parameters into an explicit window. An explicit {@code from}/{@code to} pair wins over a named
 * range; with neither the last seven days are used.
 */
@Component
public class TimeRangeResolver {

    static final String DEFAULT_RANGE = "7d";

    private final Clock clock;

    public TimeRangeResolver(Clock clock) {
        this.clock = clock;
    }

    public TimeWindow resolve(String range, String from, String to) {
        boolean hasFrom = from != null && !from.isBlank();
        boolean hasTo = to != null && !to.isBlank();
        if (hasFrom || hasTo) {
            if (!hasFrom || !hasTo) {
                throw new IllegalArgumentException("from and to must be supplied together");
            }
            Instant start = parse("from", from);
            Instant end = parse("to", to);
            if (!end.isAfter(start)) {
                throw new IllegalArgumentException("to must be after from");
            }
            return new TimeWindow(start, end);
        }
        Instant now = clock.instant();
        return new TimeWindow(now.minus(namedRange(range)), now);
    }

    static Duration namedRange(String range) {
        String value = range == null || range.isBlank() ? DEFAULT_RANGE : range.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "24h" -> Duration.ofHours(24);
            case "7d" -> Duration.ofDays(7);
            case "30d" -> Duration.ofDays(30);
            case "90d" -> Duration.ofDays(90);
            default -> throw new IllegalArgumentException("Unsupported range: " + range);
        };
    }

    private static Instant parse(String name, String value) {
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(name + " must be an ISO-8601 instant: " + value, ex);
        }
    }
}
