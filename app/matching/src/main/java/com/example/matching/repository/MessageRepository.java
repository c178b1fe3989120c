/*
 * どこで: Chat データアクセス
 * 何を: messages の追記と match 単位の時系列取得を行う
 * なぜ: 送信済みメッセージを追記のみで保持するため
 */
package com.example.matching.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.matching.model.MessageRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MessageRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public MessageRecord insert(MessageRecord record) {
    final String sql =
        """
        INSERT INTO messages (id, match_id, sender_id, receiver_id, content, created_at)
        VALUES (:id, :matchId, :senderId, :receiverId, :content, :createdAt)
        RETURNING id, match_id, sender_id, receiver_id, content, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("matchId", record.matchId())
            .addValue("senderId", record.senderId())
            .addValue("receiverId", record.receiverId())
            .addValue("content", record.content())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return StorageCalls.call(
        "message.insert", () -> jdbcTemplate.queryForObject(sql, params, this::mapRow));
  }

  public List<MessageRecord> findByMatchId(UUID matchId) {
    // 同一時刻の送信は id で順序を固定する
    final String sql =
        """
        SELECT id, match_id, sender_id, receiver_id, content, created_at
        FROM messages
        WHERE match_id = :matchId
        ORDER BY created_at ASC, id ASC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("matchId", matchId);
    return StorageCalls.call(
        "message.find_by_match", () -> jdbcTemplate.query(sql, params, this::mapRow));
  }

  private MessageRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MessageRecord(
        rs.getObject("id", UUID.class),
        rs.getObject("match_id", UUID.class),
        rs.getObject("sender_id", UUID.class),
        rs.getObject("receiver_id", UUID.class),
        rs.getString("content"),
        getInstant(rs, "created_at"));
  }
}
