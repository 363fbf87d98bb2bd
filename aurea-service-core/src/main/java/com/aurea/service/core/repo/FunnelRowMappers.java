package com.aurea.service.core.repo;

import com.aurea.service.core.model.DeviceInfo;
import com.aurea.service.core.model.FunnelEvent;
import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.model.Geography;
import com.aurea.service.core.model.LifecycleStage;
import com.aurea.service.core.model.TouchAttribution;
import com.aurea.service.core.model.VisitorProfile;
import com.aurea.service.core.model.VitalRating;
import com.aurea.service.core.model.WebVitalSample;
import com.aurea.service.core.model.WebVitals;
import com.aurea.service.core.support.JsonColumns;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import org.springframework.jdbc.core.RowMapper;

final class FunnelRowMappers {

    static final String SESSION_COLUMNS =
            """
            session_id, anonymous_id, user_id, started_at, ended_at, page_views, events_count,
            duration_seconds, active_time_seconds, engagement_rate, current_stage, stage_history::text as stage_history,
            is_abandoned, converted, conversion_value, conversion_platform,
            first_source, first_medium, first_campaign, first_fbclid, first_gclid, first_ttclid,
            last_source, last_medium, last_campaign, last_fbclid, last_gclid, last_ttclid,
            device_type, browser_name, browser_version, os_name, os_version,
            country_code, country_name, region, city,
            avg_lcp, avg_inp, avg_cls, avg_fcp, avg_ttfb, experience_score
            """;

    static final String EVENT_COLUMNS =
            """
            event_id, session_id, anonymous_id, user_id, event_name, event_category, event_description,
            is_micro_conversion, micro_conversion_type, micro_conversion_value, revenue,
            page_url, page_title, page_path, is_conversion, funnel_stage, utm_source, utm_medium, utm_campaign,
            device_type, browser_name, browser_version, os_name, os_version,
            country_code, country_name, region, city, properties::text as properties, "timestamp"
            """;

    static final String WEB_VITAL_COLUMNS =
            """
            id, session_id, anonymous_id, page_url, page_path, metric, "value", rating,
            device_type, browser_name, country_name, "timestamp"
            """;

    static final RowMapper<FunnelSession> SESSION = (rs, rowNum) -> new FunnelSession(
            rs.getString("session_id"),
            rs.getString("anonymous_id"),
            rs.getString("user_id"),
            instant(rs, "started_at"),
            instant(rs, "ended_at"),
            rs.getInt("page_views"),
            rs.getInt("events_count"),
            nullableInt(rs, "duration_seconds"),
            nullableInt(rs, "active_time_seconds"),
            nullableDouble(rs, "engagement_rate"),
            rs.getString("current_stage"),
            JsonColumns.readStageHistory(rs.getString("stage_history")),
            rs.getBoolean("is_abandoned"),
            rs.getBoolean("converted"),
            nullableDouble(rs, "conversion_value"),
            rs.getString("conversion_platform"),
            touch(rs, "first_"),
            touch(rs, "last_"),
            device(rs),
            geography(rs),
            new WebVitals(
                    nullableDouble(rs, "avg_lcp"),
                    nullableDouble(rs, "avg_inp"),
                    nullableDouble(rs, "avg_cls"),
                    nullableDouble(rs, "avg_fcp"),
                    nullableDouble(rs, "avg_ttfb")),
            nullableInt(rs, "experience_score"));

    static final RowMapper<FunnelEvent> EVENT = (rs, rowNum) -> new FunnelEvent(
            rs.getString("event_id"),
            rs.getString("session_id"),
            rs.getString("anonymous_id"),
            rs.getString("user_id"),
            rs.getString("event_name"),
            rs.getString("event_category"),
            rs.getString("event_description"),
            rs.getBoolean("is_micro_conversion"),
            rs.getString("micro_conversion_type"),
            nullableDouble(rs, "micro_conversion_value"),
            nullableDouble(rs, "revenue"),
            rs.getString("page_url"),
            rs.getString("page_title"),
            rs.getString("page_path"),
            rs.getBoolean("is_conversion"),
            rs.getString("funnel_stage"),
            rs.getString("utm_source"),
            rs.getString("utm_medium"),
            rs.getString("utm_campaign"),
            device(rs),
            geography(rs),
            JsonColumns.readObject(rs.getString("properties")),
            instant(rs, "timestamp"));

    static final RowMapper<VisitorProfile> PROFILE = (rs, rowNum) -> new VisitorProfile(
            rs.getString("id"),
            rs.getString("display_name"),
            rs.getString("identified_user_id"),
            instant(rs, "first_seen"),
            instant(rs, "last_seen"),
            rs.getInt("total_sessions"),
            rs.getInt("total_events"),
            LifecycleStage.fromValue(rs.getString("lifecycle_stage")));

    static final RowMapper<WebVitalSample> WEB_VITAL = (rs, rowNum) -> new WebVitalSample(
            rs.getString("id"),
            rs.getString("session_id"),
            rs.getString("anonymous_id"),
            rs.getString("page_url"),
            rs.getString("page_path"),
            rs.getString("metric"),
            rs.getDouble("value"),
            VitalRating.fromValue(rs.getString("rating")),
            rs.getString("device_type"),
            rs.getString("browser_name"),
            rs.getString("country_name"),
            instant(rs, "timestamp"));

    private FunnelRowMappers() {}

    static Geography geography(ResultSet rs) throws SQLException {
        return new Geography(
                rs.getString("country_code"), rs.getString("country_name"), rs.getString("region"), rs.getString("city"));
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    private static DeviceInfo device(ResultSet rs) throws SQLException {
        return new DeviceInfo(
                rs.getString("device_type"),
                rs.getString("browser_name"),
                rs.getString("browser_version"),
                rs.getString("os_name"),
                rs.getString("os_version"));
    }

    private static TouchAttribution touch(ResultSet rs, String prefix) throws SQLException {
        return new TouchAttribution(
                rs.getString(prefix + "source"),
                rs.getString(prefix + "medium"),
                rs.getString(prefix + "campaign"),
                rs.getString(prefix + "fbclid"),
                rs.getString(prefix + "gclid"),
                rs.getString(prefix + "ttclid"));
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
