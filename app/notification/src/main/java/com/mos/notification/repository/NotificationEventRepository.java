/*
 * どこで: Notification データアクセス
 * 何を: notification_events の冪等登録/取得/終端状態への更新を担う
 * なぜ: 重複スキャンに対する冪等性を DB の一意制約で保証するため
 */
package com.mos.notification.repository;

import static com.mos.common.JdbcTimestampUtils.toInstant;
import static com.mos.common.JdbcTimestampUtils.toTimestamp;

import com.mos.notification.model.NotificationEventKind;
import com.mos.notification.model.NotificationEventRecord;
import com.mos.notification.model.NotificationEventStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationEventRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT id, kind, task_id, stage, slot, payload::text AS payload_text, rendered_text, status,
             created_at, rendered_at
      FROM notification_events
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts a deadline reminder unless one already exists for the same task and stage.
   *
   * @return {@code true} only when a new row was written
   */
  public boolean insertDeadlineReminderIfAbsent(
      UUID eventId, UUID taskId, String stage, String payloadJson, Instant createdAt) {
    // 部分ユニークインデックスと同じ述語を ON CONFLICT に書き、競合は no-op にする
    final String sql =
        """
        INSERT INTO notification_events (
          id, kind, task_id, stage, payload, status, created_at
        ) VALUES (
          :id, :kind, :taskId, :stage, :payloadJson::jsonb, :status, :createdAt
        )
        ON CONFLICT (task_id, stage)
          WHERE kind = 'task_deadline_reminder' AND task_id IS NOT NULL AND stage IS NOT NULL
        DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", eventId)
            .addValue("kind", NotificationEventKind.TASK_DEADLINE_REMINDER.dbValue())
            .addValue("taskId", taskId)
            .addValue("stage", stage)
            .addValue("payloadJson", payloadJson)
            .addValue("status", NotificationEventStatus.CREATED.dbValue())
            .addValue("createdAt", toTimestamp(createdAt));
    try {
      return jdbcTemplate.update(sql, params) > 0;
    } catch (DuplicateKeyException ex) {
      return false;
    }
  }

  public UUID insert(NotificationEventRecord record) {
    final String sql =
        """
        INSERT INTO notification_events (
          id, kind, task_id, stage, slot, payload, rendered_text, status, created_at, rendered_at
        ) VALUES (
          :id, :kind, :taskId, :stage, :slot, :payloadJson::jsonb, :renderedText, :status,
          :createdAt, :renderedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.eventId())
            .addValue("kind", record.kind())
            .addValue("taskId", record.taskId())
            .addValue("stage", record.stage())
            .addValue("slot", record.slot())
            .addValue("payloadJson", record.payloadJson())
            .addValue("renderedText", record.renderedText())
            .addValue("status", record.status().dbValue())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("renderedAt", toTimestamp(record.renderedAt()));
    jdbcTemplate.update(sql, params);
    return record.eventId();
  }

  public List<NotificationEventRecord> findOldestByStatus(NotificationEventStatus status, int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE status = :status
            ORDER BY created_at ASC, id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("status", status.dbValue()).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationEventRecord> findLatestByStatus(NotificationEventStatus status, int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE status = :status
            ORDER BY created_at DESC, id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("status", status.dbValue()).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<NotificationEventRecord> findById(UUID eventId) {
    final String sql = SELECT_COLUMNS + "WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int countByStatus(NotificationEventStatus status) {
    final String sql = "SELECT COUNT(*) FROM notification_events WHERE status = :status";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("status", status.dbValue());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int markRendered(UUID eventId, String renderedText, Instant renderedAt) {
    // created からの遷移だけを許可し、終端状態を巻き戻さない
    final String sql =
        """
        UPDATE notification_events
        SET status = 'rendered',
            rendered_text = :renderedText,
            rendered_at = :renderedAt
        WHERE id = :id
          AND status = 'created'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", eventId)
            .addValue("renderedText", renderedText)
            .addValue("renderedAt", toTimestamp(renderedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(UUID eventId, String errorMessage) {
    final String sql =
        """
        UPDATE notification_events
        SET status = 'failed',
            rendered_text = :errorMessage
        WHERE id = :id
          AND status = 'created'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", eventId).addValue("errorMessage", errorMessage);
    return jdbcTemplate.update(sql, params);
  }

  private NotificationEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String taskId = rs.getString("task_id");
    return new NotificationEventRecord(
        UUID.fromString(rs.getString("id")),
        rs.getString("kind"),
        taskId == null ? null : UUID.fromString(taskId),
        rs.getString("stage"),
        rs.getString("slot"),
        rs.getString("payload_text"),
        rs.getString("rendered_text"),
        NotificationEventStatus.fromDbValue(rs.getString("status")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("rendered_at")));
  }
}
