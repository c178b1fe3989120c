/*
 * どこで: MatchRepository の統合テスト
 * 何を: 正規化ペアでの原子的作成と一覧順序を検証する
 * なぜ: 同時作成でもマッチが 1 行に収束することを実 DB で保証するため
 */
package com.example.matching.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.matching.AbstractPostgresContainerTest;
import com.example.matching.model.MatchCreation;
import com.example.matching.model.MatchRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class MatchRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T00:00:00Z");
  private static final int CONCURRENT_THREADS = 8;
  private static final Duration LATCH_TIMEOUT = Duration.ofSeconds(10);

  @Autowired private MatchRepository matchRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM messages", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM matches", new MapSqlParameterSource());
  }

  @Test
  void createIfAbsentIsIdempotentAcrossArgumentOrder() {
    final UUID alice = UUID.randomUUID();
    final UUID bob = UUID.randomUUID();

    final MatchCreation first = matchRepository.createIfAbsent(alice, bob, BASE_TIME);
    final MatchCreation second =
        matchRepository.createIfAbsent(bob, alice, BASE_TIME.plusSeconds(1));

    assertThat(first.created()).isTrue();
    assertThat(second.created()).isFalse();
    assertThat(second.match().matchId()).isEqualTo(first.match().matchId());
    assertThat(second.match().createdAt()).isEqualTo(BASE_TIME);
    assertThat(matchRepository.exists(bob, alice)).isTrue();
    assertThat(countMatches()).isEqualTo(1);
  }

  @Test
  void concurrentCreateIfAbsentProducesSingleMatch() throws InterruptedException {
    final UUID alice = UUID.randomUUID();
    final UUID bob = UUID.randomUUID();
    final CountDownLatch ready = new CountDownLatch(CONCURRENT_THREADS);
    final CountDownLatch start = new CountDownLatch(1);
    final CountDownLatch done = new CountDownLatch(CONCURRENT_THREADS);
    final List<MatchCreation> results = new CopyOnWriteArrayList<>();
    final List<Throwable> errors = new CopyOnWriteArrayList<>();
    final ExecutorService executor = Executors.newFixedThreadPool(CONCURRENT_THREADS);

    try {
      for (int i = 0; i < CONCURRENT_THREADS; i++) {
        // 半数は逆順で呼び、正規化が効いていることも同時に確かめる
        final UUID first = i % 2 == 0 ? alice : bob;
        final UUID second = i % 2 == 0 ? bob : alice;
        executor.execute(
            () -> {
              ready.countDown();
              try {
                if (!start.await(LATCH_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                  errors.add(new IllegalStateException("start latch timeout"));
                  return;
                }
                results.add(matchRepository.createIfAbsent(first, second, BASE_TIME));
              } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                errors.add(ex);
              } catch (RuntimeException ex) {
                errors.add(ex);
              } finally {
                done.countDown();
              }
            });
      }
      assertThat(ready.await(LATCH_TIMEOUT.toSeconds(), TimeUnit.SECONDS)).isTrue();
      start.countDown();
      assertThat(done.await(LATCH_TIMEOUT.toSeconds() * 3, TimeUnit.SECONDS)).isTrue();
    } finally {
      executor.shutdownNow();
    }

    assertThat(errors).isEmpty();
    assertThat(results).hasSize(CONCURRENT_THREADS);
    assertThat(results).filteredOn(MatchCreation::created).hasSize(1);
    assertThat(results.stream().map(result -> result.match().matchId()).distinct()).hasSize(1);
    assertThat(countMatches()).isEqualTo(1);
  }

  @Test
  void findByUserIdReturnsNewestFirst() {
    final UUID bob = UUID.randomUUID();
    final MatchRecord older =
        matchRepository.createIfAbsent(UUID.randomUUID(), bob, BASE_TIME).match();
    final MatchRecord newer =
        matchRepository.createIfAbsent(bob, UUID.randomUUID(), BASE_TIME.plusSeconds(60)).match();

    assertThat(matchRepository.findByUserId(bob))
        .extracting(MatchRecord::matchId)
        .containsExactly(newer.matchId(), older.matchId());
    assertThat(matchRepository.findByUserId(UUID.randomUUID())).isEmpty();
  }

  @Test
  void findByIdReturnsEmptyForUnknownMatch() {
    assertThat(matchRepository.findById(UUID.randomUUID())).isEmpty();
  }

  private int countMatches() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM matches", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }
}
