package com.aurea.service.core.repo;

import com.aurea.service.core.model.Funnel;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class FunnelRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public FunnelRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Funnel> findById(UUID funnelId) {
        if (funnelId == null) {
            return Optional.empty();
        }
        List<Funnel> rows = jdbc.query(
                """
                select id, organization_id, subaccount_id, name
                  from funnel
                 where id = :id
                """,
                new MapSqlParameterSource("id", funnelId),
                (rs, rowNum) -> new Funnel(
                        (UUID) rs.getObject("id"),
                        rs.getString("organization_id"),
                        rs.getString("subaccount_id"),
                        rs.getString("name")));
        return rows.stream().findFirst();
    }
}
