package com.example.matching.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.getLocalDate;
import static com.example.common.JdbcTimestampUtils.toSqlDate;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.matching.model.Gender;
import com.example.matching.model.UserRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserRecord> findByUserId(UUID userId) {
    final String sql =
        """
        SELECT user_id, name, gender, birth_date, bio, created_at, updated_at
        FROM users
        WHERE user_id = :userId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return StorageCalls.call(
        "user.find", () -> jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst());
  }

  public List<UserRecord> findByUserIds(Collection<UUID> userIds) {
    if (userIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT user_id, name, gender, birth_date, bio, created_at, updated_at
        FROM users
        WHERE user_id IN (:userIds)
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userIds", userIds);
    return StorageCalls.call(
        "user.find_many", () -> jdbcTemplate.query(sql, params, this::mapRow));
  }

  /** 既にプロフィールがある場合は何もせず空を返す。 */
  public Optional<UserRecord> insertIfAbsent(UserRecord user) {
    final String sql =
        """
        INSERT INTO users (user_id, name, gender, birth_date, bio, created_at, updated_at)
        VALUES (:userId, :name, :gender, :birthDate, :bio, :createdAt, :updatedAt)
        ON CONFLICT (user_id) DO NOTHING
        RETURNING user_id, name, gender, birth_date, bio, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", user.userId())
            .addValue("name", user.name())
            .addValue("gender", user.gender().value())
            .addValue("birthDate", toSqlDate(user.birthDate()))
            .addValue("bio", user.bio())
            .addValue("createdAt", toTimestamp(user.createdAt()))
            .addValue("updatedAt", toTimestamp(user.updatedAt()));
    return StorageCalls.call(
        "user.insert", () -> jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst());
  }

  /** null の項目は現在値を維持する。 */
  public Optional<UserRecord> updateProfile(
      UUID userId, String name, String bio, Instant updatedAt) {
    final String sql =
        """
        UPDATE users
        SET name = COALESCE(:name, name),
            bio = COALESCE(:bio, bio),
            updated_at = :updatedAt
        WHERE user_id = :userId
        RETURNING user_id, name, gender, birth_date, bio, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("name", name, Types.VARCHAR)
            .addValue("bio", bio, Types.VARCHAR)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return StorageCalls.call(
        "user.update", () -> jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst());
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getObject("user_id", UUID.class),
        rs.getString("name"),
        Gender.fromValue(rs.getString("gender")),
        getLocalDate(rs, "birth_date"),
        rs.getString("bio"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
