package com.aurea.service.core.repo;

import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.model.TimeWindow;
import java.sql.Timestamp;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Reads funnel sessions. Window filters apply to {@code started_at}, both bounds inclusive. */
@Repository
public class SessionRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public SessionRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<FunnelSession> findInWindow(UUID funnelId, TimeWindow window) {
        return queryWindow(funnelId, window, "");
    }

    public List<FunnelSession> findConvertedInWindow(UUID funnelId, TimeWindow window) {
        return queryWindow(funnelId, window, " and converted = true");
    }

    /** Sessions whose engagement was measured. */
    public List<FunnelSession> findWithEngagementInWindow(UUID funnelId, TimeWindow window) {
        return queryWindow(funnelId, window, " and engagement_rate is not null");
    }

    /** Empty when the session does not exist or belongs to another funnel. */
    public Optional<FunnelSession> findBySessionId(UUID funnelId, String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("funnel_id", funnelId)
                .addValue("session_id", sessionId);
        List<FunnelSession> rows = jdbc.query(
                "select " + FunnelRowMappers.SESSION_COLUMNS
                        + " from funnel_session where session_id = :session_id and funnel_id = :funnel_id",
                params,
                FunnelRowMappers.SESSION);
        return rows.stream().findFirst();
    }

    /** All sessions of one visitor in the funnel, newest first. */
    public List<FunnelSession> findForVisitor(UUID funnelId, String anonymousId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("funnel_id", funnelId)
                .addValue("anonymous_id", anonymousId);
        return jdbc.query(
                "select " + FunnelRowMappers.SESSION_COLUMNS
                        + """
                          from funnel_session
                         where funnel_id = :funnel_id
                           and anonymous_id = :anonymous_id
                         order by started_at desc
                        """,
                params,
                FunnelRowMappers.SESSION);
    }

    /** Newest session per visitor, keyed by anonymous id. */
    public Map<String, FunnelSession> findLatestForVisitors(UUID funnelId, Collection<String> anonymousIds) {
        if (anonymousIds == null || anonymousIds.isEmpty()) {
            return Map.of();
        }
        String sql = "select distinct on (anonymous_id) " + FunnelRowMappers.SESSION_COLUMNS
                + """
                  from funnel_session
                 where funnel_id = :funnel_id
                   and anonymous_id in (:anonymous_ids)
                 order by anonymous_id, started_at desc
                """;
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("funnel_id", funnelId);
        Map<String, FunnelSession> out = new LinkedHashMap<>();
        for (List<String> chunk : InClauseChunks.partition(anonymousIds)) {
            params.addValue("anonymous_ids", chunk);
            for (FunnelSession session : jdbc.query(sql, params, FunnelRowMappers.SESSION)) {
                out.put(session.anonymousId(), session);
            }
        }
        return out;
    }

    /** Subset of {@code sessionIds} whose session converted, regardless of when it started. */
    public Set<String> findConvertedSessionIds(UUID funnelId, Collection<String> sessionIds) {
        if (sessionIds == null || sessionIds.isEmpty()) {
            return Set.of();
        }
        String sql = """
                select session_id
                  from funnel_session
                 where funnel_id = :funnel_id
                   and session_id in (:session_ids)
                   and converted = true
                """;
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("funnel_id", funnelId);
        Set<String> out = new HashSet<>();
        for (List<String> chunk : InClauseChunks.partition(sessionIds)) {
            params.addValue("session_ids", chunk);
            out.addAll(jdbc.query(sql, params, (rs, rowNum) -> rs.getString("session_id")));
        }
        return out;
    }

    private List<FunnelSession> queryWindow(UUID funnelId, TimeWindow window, String extraPredicate) {
        String sql = "select " + FunnelRowMappers.SESSION_COLUMNS
                + """
                  from funnel_session
                 where funnel_id = :funnel_id
                   and started_at >= :start
                   and started_at <= :end
                """
                + extraPredicate
                + " order by started_at asc";
        return jdbc.query(sql, windowParams(funnelId, window), FunnelRowMappers.SESSION);
    }

    private static MapSqlParameterSource windowParams(UUID funnelId, TimeWindow window) {
        return new MapSqlParameterSource()
                .addValue("funnel_id", funnelId)
                .addValue("start", Timestamp.from(window.from()))
                .addValue("end", Timestamp.from(window.to()));
    }
}
