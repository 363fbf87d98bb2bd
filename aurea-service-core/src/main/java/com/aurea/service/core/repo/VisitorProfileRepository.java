package com.aurea.service.core.repo;

import com.aurea.service.core.model.LifecycleStage;
import com.aurea.service.core.model.VisitorProfile;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

/** Visitor profiles belong to a funnel through at least one session whose anonymous id equals the profile id. */
@Repository
public class VisitorProfileRepository {
    private static final String PROFILE_COLUMNS =
            "p.id, p.display_name, p.identified_user_id, p.first_seen, p.last_seen, p.total_sessions,"
                    + " p.total_events, p.lifecycle_stage";
    private static final String IN_FUNNEL =
            " exists (select 1 from funnel_session s where s.anonymous_id = p.id and s.funnel_id = :funnel_id)";

    private final NamedParameterJdbcTemplate jdbc;

    public VisitorProfileRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<VisitorProfile> findUnclassifiedForFunnel(UUID funnelId) {
        return jdbc.query(
                "select " + PROFILE_COLUMNS + " from visitor_profile p where p.lifecycle_stage is null and"
                        + IN_FUNNEL,
                new MapSqlParameterSource("funnel_id", funnelId),
                FunnelRowMappers.PROFILE);
    }

    /**
     * Writes computed stages for profiles that are still unset. Concurrent writers compute the same value, so a row
     * already written by another request is simply skipped.
     *
     * @return number of rows written
     */
    public int updateLifecycleStages(Map<String, LifecycleStage> stages) {
        if (stages == null || stages.isEmpty()) {
            return 0;
        }
        List<SqlParameterSource> batch = new ArrayList<>(stages.size());
        stages.forEach((id, stage) -> batch.add(
                new MapSqlParameterSource().addValue("id", id).addValue("stage", stage.name())));
        int[] counts = jdbc.batchUpdate(
                """
                update visitor_profile
                   set lifecycle_stage = :stage
                 where id = :id
                   and lifecycle_stage is null
                """,
                batch.toArray(new SqlParameterSource[0]));
        int written = 0;
        for (int count : counts) {
            written += Math.max(count, 0);
        }
        return written;
    }

    /**
     * Keyset page ordered by last seen descending, then id descending. {@code cursor} is the id of the last profile
     * of the previous page.
     */
    public List<VisitorProfile> findPage(UUID funnelId, VisitorProfileFilter filter, String cursor, int limit) {
        VisitorProfileFilter effective = filter == null ? VisitorProfileFilter.none() : filter;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("funnel_id", funnelId)
                .addValue("limit", Math.max(1, limit));
        StringBuilder sql = new StringBuilder("select " + PROFILE_COLUMNS + " from visitor_profile p where" + IN_FUNNEL);
        if (effective.lifecycleStage() != null) {
            sql.append(" and p.lifecycle_stage = :lifecycle_stage");
            params.addValue("lifecycle_stage", effective.lifecycleStage().name());
        }
        if (effective.hasIdentified() != null) {
            sql.append(effective.hasIdentified()
                    ? " and p.identified_user_id is not null"
                    : " and p.identified_user_id is null");
        }
        if (effective.hasSearch()) {
            sql.append(" and (p.display_name ilike :search or p.identified_user_id ilike :search)");
            params.addValue("search", "%" + effective.searchQuery().trim() + "%");
        }
        if (cursor != null && !cursor.isBlank()) {
            sql.append(" and (coalesce(p.last_seen, 'epoch'::timestamptz), p.id) <"
                    + " (select coalesce(c.last_seen, 'epoch'::timestamptz), c.id"
                    + " from visitor_profile c where c.id = :cursor)");
            params.addValue("cursor", cursor);
        }
        sql.append(" order by coalesce(p.last_seen, 'epoch'::timestamptz) desc, p.id desc limit :limit");
        return jdbc.query(sql.toString(), params, FunnelRowMappers.PROFILE);
    }

    /** Empty when the profile does not exist or has no session in the funnel. */
    public Optional<VisitorProfile> findById(UUID funnelId, String id) {
        if (id == null) {
            return Optional.empty();
        }
        List<VisitorProfile> rows = jdbc.query(
                "select " + PROFILE_COLUMNS + " from visitor_profile p where p.id = :id and" + IN_FUNNEL,
                new MapSqlParameterSource().addValue("id", id).addValue("funnel_id", funnelId),
                FunnelRowMappers.PROFILE);
        return rows.stream().findFirst();
    }
}
