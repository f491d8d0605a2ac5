/*
 * どこで: Notification データアクセス
 * 何を: tasks テーブルの読み取り(期限付き候補の取得/フォローアップ集計)を担う
 * なぜ: タスクは外部所有のため、このサービスからは参照だけに限定するため
 */
package com.mos.notification.repository;

import static com.mos.common.JdbcTimestampUtils.toLocalDate;
import static com.mos.common.JdbcTimestampUtils.toLocalTime;
import static com.mos.common.JdbcTimestampUtils.toSqlDate;

import com.mos.notification.model.TaskSnapshot;
import com.mos.notification.model.TaskStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TaskQueryRepository {

  private static final Logger logger = LoggerFactory.getLogger(TaskQueryRepository.class);

  private static final List<String> TERMINAL_STATUSES =
      List.of(TaskStatus.DONE.dbValue(), TaskStatus.CANCELED.dbValue());

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<TaskSnapshot> listDueTasks(int maxRows) {
    final String sql =
        """
        SELECT id, title, description, status, priority, due_date, due_time
        FROM tasks
        WHERE due_date IS NOT NULL
          AND status NOT IN (:terminalStatuses)
        ORDER BY due_date ASC, id
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("terminalStatuses", TERMINAL_STATUSES)
            .addValue("limit", maxRows);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countOverdue(LocalDate today) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM tasks
        WHERE due_date IS NOT NULL
          AND due_date < :today
          AND status NOT IN (:terminalStatuses)
        """;
    return count(sql, new MapSqlParameterSource()
        .addValue("today", toSqlDate(today))
        .addValue("terminalStatuses", TERMINAL_STATUSES));
  }

  public int countDueOn(LocalDate date) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM tasks
        WHERE due_date = :date
          AND status NOT IN (:terminalStatuses)
        """;
    return count(sql, new MapSqlParameterSource()
        .addValue("date", toSqlDate(date))
        .addValue("terminalStatuses", TERMINAL_STATUSES));
  }

  public int countByStatus(TaskStatus status) {
    final String sql = "SELECT COUNT(*) FROM tasks WHERE status = :status";
    return count(sql, new MapSqlParameterSource().addValue("status", status.dbValue()));
  }

  private int count(String sql, MapSqlParameterSource params) {
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private TaskSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String rawStatus = rs.getString("status");
    final TaskStatus status = TaskStatus.fromDbValue(rawStatus);
    if (status == TaskStatus.UNKNOWN) {
      // 1 行の想定外値でスキャン全体を止めない
      logger.warn("task has unrecognized status; treating as active taskId={} status={}",
          rs.getString("id"), rawStatus);
    }
    return new TaskSnapshot(
        UUID.fromString(rs.getString("id")),
        rs.getString("title"),
        rs.getString("description"),
        status,
        rs.getString("priority"),
        toLocalDate(rs.getDate("due_date")),
        toLocalTime(rs.getTime("due_time")));
  }
}
