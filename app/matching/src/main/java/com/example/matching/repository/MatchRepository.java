/*
 * どこで: Matching データアクセス
 * 何を: matches の存在確認/原子的な作成/参照を行う
 * なぜ: 同一ペアのマッチを一意制約だけで 1 件に保つため
 */
package com.example.matching.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.matching.model.CanonicalPair;
import com.example.matching.model.MatchCreation;
import com.example.matching.model.MatchRecord;
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
public class MatchRepository {

  private static final String COLUMNS = "id, user_low, user_high, created_at, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean exists(UUID first, UUID second) {
    final CanonicalPair pair = CanonicalPair.of(first, second);
    final String sql =
        """
        SELECT EXISTS(
          SELECT 1 FROM matches
          WHERE user_low = :userLow AND user_high = :userHigh
        )
        """;
    final Boolean exists =
        StorageCalls.call(
            "match.exists",
            () -> jdbcTemplate.queryForObject(sql, pairParams(pair), Boolean.class));
    return Boolean.TRUE.equals(exists);
  }

  /**
   * 役割: 正規化したペアでマッチを作成し、既存ならその行を返す。
   *
   * <p>期待動作: 同時に呼ばれても created=true を観測するのは 1 呼び出しだけ。
   * 存在確認は挿入後に行い、アプリ側の check-then-insert はしない。
   */
  public MatchCreation createIfAbsent(UUID first, UUID second, Instant now) {
    final CanonicalPair pair = CanonicalPair.of(first, second);
    return StorageCalls.call(
        "match.create_if_absent",
        () -> {
          final Optional<MatchRecord> inserted = insertIfAbsent(pair, now);
          if (inserted.isPresent()) {
            return new MatchCreation(inserted.get(), true);
          }
          // 競合した側は先行トランザクションのコミット後に既存行を読み直す
          final MatchRecord existing =
              findByPair(pair)
                  .orElseThrow(
                      () -> new IllegalStateException("match conflict without existing row"));
          return new MatchCreation(existing, false);
        });
  }

  public Optional<MatchRecord> findById(UUID matchId) {
    final String sql = "SELECT " + COLUMNS + " FROM matches WHERE id = :matchId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("matchId", matchId);
    return StorageCalls.call(
        "match.find_by_id",
        () -> jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst());
  }

  public List<MatchRecord> findByUserId(UUID userId) {
    final String sql =
        """
        SELECT id, user_low, user_high, created_at, updated_at
        FROM matches
        WHERE user_low = :userId OR user_high = :userId
        ORDER BY created_at DESC, id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return StorageCalls.call(
        "match.find_by_user", () -> jdbcTemplate.query(sql, params, this::mapRow));
  }

  private Optional<MatchRecord> insertIfAbsent(CanonicalPair pair, Instant now) {
    final String sql =
        """
        INSERT INTO matches (id, user_low, user_high, created_at, updated_at)
        VALUES (:id, :userLow, :userHigh, :createdAt, :updatedAt)
        ON CONFLICT (user_low, user_high) DO NOTHING
        RETURNING id, user_low, user_high, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        pairParams(pair)
            .addValue("id", UUID.randomUUID())
            .addValue("createdAt", toTimestamp(now))
            .addValue("updatedAt", toTimestamp(now));
    try {
      return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    } catch (DuplicateKeyException ex) {
      // 一意制約違反がエラーとして返った場合も「既に存在する」の合図として扱う
      return Optional.empty();
    }
  }

  private Optional<MatchRecord> findByPair(CanonicalPair pair) {
    final String sql =
        "SELECT " + COLUMNS + " FROM matches WHERE user_low = :userLow AND user_high = :userHigh";
    return jdbcTemplate.query(sql, pairParams(pair), this::mapRow).stream().findFirst();
  }

  private MapSqlParameterSource pairParams(CanonicalPair pair) {
    return new MapSqlParameterSource()
        .addValue("userLow", pair.low())
        .addValue("userHigh", pair.high());
  }

  private MatchRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MatchRecord(
        rs.getObject("id", UUID.class),
        rs.getObject("user_low", UUID.class),
        rs.getObject("user_high", UUID.class),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
