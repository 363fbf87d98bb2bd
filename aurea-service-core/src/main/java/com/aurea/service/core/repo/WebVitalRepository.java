package com.aurea.service.core.repo;

import com.aurea.service.core.model.TimeWindow;
import com.aurea.service.core.model.WebVitalSample;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Reads individual web-vital measurements. The window applies to the measurement timestamp, both bounds inclusive. */
@Repository
public class WebVitalRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public WebVitalRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<WebVitalSample> findInWindow(UUID funnelId, TimeWindow window) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("funnel_id", funnelId)
                .addValue("start", Timestamp.from(window.from()))
                .addValue("end", Timestamp.from(window.to()));
        return jdbc.query(
                "select " + FunnelRowMappers.WEB_VITAL_COLUMNS
                        + """
                          from funnel_web_vital
                         where funnel_id = :funnel_id
                           and "timestamp" >= :start
                           and "timestamp" <= :end
                         order by "timestamp" asc
                        """,
                params,
                FunnelRowMappers.WEB_VITAL);
    }
}
