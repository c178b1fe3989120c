/*
 * どこで: Matching データアクセス
 * 何を: preferences の登録と相互 like の判定を行う
 * なぜ: (user_id, target_user_id) の一意制約で判定の重複を DB 側で防ぐため
 */
package com.example.matching.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.matching.model.Decision;
import com.example.matching.model.Mutuality;
import com.example.matching.model.PreferenceRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PreferenceRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 既に同じ向きの判定がある場合は何も書き込まず空を返す。 */
  public Optional<PreferenceRecord> insertIfAbsent(PreferenceRecord record) {
    final String sql =
        """
        INSERT INTO preferences (
          id,
          user_id,
          target_user_id,
          status,
          created_at,
          updated_at
        ) VALUES (
          :id,
          :userId,
          :targetUserId,
          :status,
          :createdAt,
          :updatedAt
        )
        ON CONFLICT (user_id, target_user_id) DO NOTHING
        RETURNING id, user_id, target_user_id, status, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("userId", record.userId())
            .addValue("targetUserId", record.targetUserId())
            .addValue("status", record.decision().value())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    return StorageCalls.call(
        "preference.insert",
        () -> jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst());
  }

  public Optional<PreferenceRecord> findByUserAndTarget(UUID userId, UUID targetUserId) {
    final String sql =
        """
        SELECT id, user_id, target_user_id, status, created_at, updated_at
        FROM preferences
        WHERE user_id = :userId AND target_user_id = :targetUserId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("targetUserId", targetUserId);
    return StorageCalls.call(
        "preference.find",
        () -> jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst());
  }

  /** target が actor を like 済みかを判定する。障害時は例外で返し NOT_MUTUAL にはしない。 */
  public Mutuality checkMutual(UUID actorId, UUID targetId) {
    final String sql =
        """
        SELECT EXISTS(
          SELECT 1 FROM preferences
          WHERE user_id = :targetId
            AND target_user_id = :actorId
            AND status = :like
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("actorId", actorId)
            .addValue("targetId", targetId)
            .addValue("like", Decision.LIKE.value());
    final Boolean exists =
        StorageCalls.call(
            "preference.check_mutual",
            () -> jdbcTemplate.queryForObject(sql, params, Boolean.class));
    return Mutuality.of(Boolean.TRUE.equals(exists));
  }

  private PreferenceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PreferenceRecord(
        rs.getObject("id", UUID.class),
        rs.getObject("user_id", UUID.class),
        rs.getObject("target_user_id", UUID.class),
        Decision.fromValue(rs.getString("status")),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
