package com.aurea.service.core.repo;

import com.aurea.service.core.attribution.GeoSighting;
import com.aurea.service.core.model.FunnelEvent;
import com.aurea.service.core.model.TimeWindow;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Reads funnel events. Window filters apply to the event timestamp, both bounds inclusive. */
@Repository
public class EventRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public EventRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /** Events of the window in ascending timestamp order. */
    public List<FunnelEvent> findInWindow(UUID funnelId, TimeWindow window, EventFilter filter) {
        EventFilter effective = filter == null ? EventFilter.all() : filter;
        if (effective.sessionIds() != null && effective.sessionIds().isEmpty()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("funnel_id", funnelId)
                .addValue("start", Timestamp.from(window.from()))
                .addValue("end", Timestamp.from(window.to()));
        StringBuilder sql = new StringBuilder("select " + FunnelRowMappers.EVENT_COLUMNS);
        sql.append(
                """
                  from funnel_event
                 where funnel_id = :funnel_id
                   and "timestamp" >= :start
                   and "timestamp" <= :end
                """);
        if (effective.eventName() != null) {
            sql.append(" and event_name = :event_name");
            params.addValue("event_name", effective.eventName());
        }
        if (effective.conversionsOnly()) {
            sql.append(" and is_conversion = true");
        }
        if (effective.microConversionsOnly()) {
            sql.append(" and is_micro_conversion = true");
        }
        if (effective.sessionIds() == null) {
            sql.append(" order by \"timestamp\" asc");
            return jdbc.query(sql.toString(), params, FunnelRowMappers.EVENT);
        }
        sql.append(" and session_id in (:session_ids) order by \"timestamp\" asc");
        List<FunnelEvent> out = new ArrayList<>();
        for (List<String> chunk : InClauseChunks.partition(effective.sessionIds())) {
            params.addValue("session_ids", chunk);
            out.addAll(jdbc.query(sql.toString(), params, FunnelRowMappers.EVENT));
        }
        out.sort(Comparator.comparing(FunnelEvent::timestamp));
        return out;
    }

    /**
     * Batched read of geography-bearing events for all sessions that need a geography fallback, newest first. Large
     * session sets are read in chunks.
     */
    public List<GeoSighting> findGeoSightings(UUID funnelId, TimeWindow window, Collection<String> sessionIds) {
        if (sessionIds == null || sessionIds.isEmpty()) {
            return List.of();
        }
        String sql = """
                select session_id, country_code, country_name, region, city, "timestamp"
                  from funnel_event
                 where funnel_id = :funnel_id
                   and session_id in (:session_ids)
                   and "timestamp" >= :start
                   and "timestamp" <= :end
                   and (country_code is not null or country_name is not null
                        or region is not null or city is not null)
                 order by "timestamp" desc
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("funnel_id", funnelId)
                .addValue("start", Timestamp.from(window.from()))
                .addValue("end", Timestamp.from(window.to()));
        List<GeoSighting> out = new ArrayList<>();
        for (List<String> chunk : InClauseChunks.partition(sessionIds)) {
            params.addValue("session_ids", chunk);
            out.addAll(jdbc.query(
                    sql,
                    params,
                    (rs, rowNum) -> new GeoSighting(
                            rs.getString("session_id"),
                            FunnelRowMappers.geography(rs),
                            FunnelRowMappers.instant(rs, "timestamp"))));
        }
        out.sort(Comparator.comparing(GeoSighting::timestamp).reversed());
        return out;
    }

    public List<FunnelEvent> findBySessionId(UUID funnelId, String sessionId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("funnel_id", funnelId)
                .addValue("session_id", sessionId);
        return jdbc.query(
                "select " + FunnelRowMappers.EVENT_COLUMNS
                        + """
                          from funnel_event
                         where funnel_id = :funnel_id
                           and session_id = :session_id
                         order by "timestamp" asc
                        """,
                params,
                FunnelRowMappers.EVENT);
    }
}
