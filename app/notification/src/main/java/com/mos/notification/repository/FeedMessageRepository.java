/*
 * どこで: Notification データアクセス
 * 何を: messages(フィード) への投影と参照を担う
 * なぜ: レンダリング結果をフィード利用側へ見せるため
 */
package com.mos.notification.repository;

import static com.mos.common.JdbcTimestampUtils.toInstant;
import static com.mos.common.JdbcTimestampUtils.toTimestamp;

import com.mos.notification.model.FeedMessageRecord;
import com.mos.notification.model.MessageRole;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class FeedMessageRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(FeedMessageRecord record) {
    final String sql =
        """
        INSERT INTO messages (id, role, content, event_id, created_at)
        VALUES (:id, :role, :content, :eventId, :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.messageId())
            .addValue("role", record.role().dbValue())
            .addValue("content", record.content())
            .addValue("eventId", record.eventId())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<FeedMessageRecord> findByEventId(UUID eventId) {
    final String sql =
        """
        SELECT id, role, content, event_id, created_at
        FROM messages
        WHERE event_id = :eventId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private FeedMessageRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String eventId = rs.getString("event_id");
    return new FeedMessageRecord(
        UUID.fromString(rs.getString("id")),
        roleOf(rs.getString("role")),
        rs.getString("content"),
        eventId == null ? null : UUID.fromString(eventId),
        toInstant(rs.getTimestamp("created_at")));
  }

  private MessageRole roleOf(String value) {
    return Arrays.stream(MessageRole.values())
        .filter(role -> role.dbValue().equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalStateException("unknown message role: " + value));
  }
}
