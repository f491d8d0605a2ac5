package com.mos.notification.repository;

import static com.mos.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class FollowupRunRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(UUID runId, String slot, String statsJson, Instant executedAt) {
    final String sql =
        """
        INSERT INTO followup_runs (id, slot, stats, executed_at)
        VALUES (:id, :slot, :statsJson::jsonb, :executedAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", runId)
            .addValue("slot", slot)
            .addValue("statsJson", statsJson)
            .addValue("executedAt", toTimestamp(executedAt));
    jdbcTemplate.update(sql, params);
  }

  public int countBySlot(String slot) {
    final String sql = "SELECT COUNT(*) FROM followup_runs WHERE slot = :slot";
    final Integer count =
        jdbcTemplate.queryForObject(sql, new MapSqlParameterSource().addValue("slot", slot), Integer.class);
    return count == null ? 0 : count;
  }
}
