package com.aurea.service.core.repo;

import com.aurea.service.core.model.FunnelEvent;
import java.util.Collection;
import java.util.Set;

/**
 * Optional narrowing of an event window read. Null fields do not filter.
 *
 * @param sessionIds restricts to these sessions when non-null; an empty set matches nothing
 */
public record EventFilter(
        String eventName, boolean conversionsOnly, boolean microConversionsOnly, Set<String> sessionIds) {

    public EventFilter {
        sessionIds = sessionIds == null ? null : Set.copyOf(sessionIds);
    }

    public static EventFilter all() {
        return new EventFilter(null, false, false, null);
    }

    public static EventFilter named(String eventName) {
        return new EventFilter(eventName, false, false, null);
    }

    public static EventFilter pageViews() {
        return named(FunnelEvent.PAGE_VIEW);
    }

    public static EventFilter conversions() {
        return new EventFilter(null, true, false, null);
    }

    public static EventFilter microConversions() {
        return new EventFilter(null, false, true, null);
    }

    public static EventFilter forSessions(Collection<String> sessionIds) {
        return new EventFilter(null, false, false, Set.copyOf(sessionIds));
    }

    /** In-memory equivalent of the SQL predicate. */
    public boolean matches(FunnelEvent event) {
        if (eventName != null && !eventName.equals(event.eventName())) {
            return false;
        }
        if (conversionsOnly && !event.conversion()) {
            return false;
        }
        if (microConversionsOnly && !event.microConversion()) {
            return false;
        }
        return sessionIds == null || sessionIds.contains(event.sessionId());
    }
}
