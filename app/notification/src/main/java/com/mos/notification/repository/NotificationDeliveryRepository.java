/*
 * どこで: Notification データアクセス
 * 何を: notification_deliveries の登録/参照を担う
 * なぜ: 配信試行を監査可能な形で残すため
 */
package com.mos.notification.repository;

import static com.mos.common.JdbcTimestampUtils.toInstant;
import static com.mos.common.JdbcTimestampUtils.toTimestamp;

import com.mos.notification.model.DeliveryChannel;
import com.mos.notification.model.DeliveryStatus;
import com.mos.notification.model.NotificationDeliveryRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationDeliveryRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(NotificationDeliveryRecord record, Instant createdAt) {
    final String sql =
        """
        INSERT INTO notification_deliveries (
          id, event_id, channel, status, destination, error, sent_at, created_at
        ) VALUES (
          :id, :eventId, :channel, :status, :destination, :error, :sentAt, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.deliveryId())
            .addValue("eventId", record.eventId())
            .addValue("channel", record.channel().dbValue())
            .addValue("status", record.status().dbValue())
            .addValue("destination", record.destination())
            .addValue("error", record.error())
            .addValue("sentAt", toTimestamp(record.sentAt()))
            .addValue("createdAt", toTimestamp(createdAt));
    jdbcTemplate.update(sql, params);
  }

  public List<NotificationDeliveryRecord> findByEventId(UUID eventId) {
    final String sql =
        """
        SELECT id, event_id, channel, status, destination, error, sent_at
        FROM notification_deliveries
        WHERE event_id = :eventId
        ORDER BY created_at
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private NotificationDeliveryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationDeliveryRecord(
        UUID.fromString(rs.getString("id")),
        UUID.fromString(rs.getString("event_id")),
        channelOf(rs.getString("channel")),
        statusOf(rs.getString("status")),
        rs.getString("destination"),
        rs.getString("error"),
        toInstant(rs.getTimestamp("sent_at")));
  }

  private DeliveryChannel channelOf(String value) {
    return Arrays.stream(DeliveryChannel.values())
        .filter(channel -> channel.dbValue().equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalStateException("unknown delivery channel: " + value));
  }

  private DeliveryStatus statusOf(String value) {
    return Arrays.stream(DeliveryStatus.values())
        .filter(status -> status.dbValue().equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalStateException("unknown delivery status: " + value));
  }
}
