/*
 * どこで: Matching サービス層
 * 何を: like/pass の記録と相互 like の検出、マッチ作成を行う
 * なぜ: 同時に相互 like が来てもマッチを取りこぼさず 1 件に収束させるため
 */
package com.example.matching.service;

import com.example.matching.api.DecisionAlreadyExistsException;
import com.example.matching.api.InvalidSelfActionException;
import com.example.matching.api.StorageUnavailableException;
import com.example.matching.model.Decision;
import com.example.matching.model.MatchCreation;
import com.example.matching.model.Mutuality;
import com.example.matching.model.PreferenceRecord;
import com.example.matching.repository.MatchRepository;
import com.example.matching.repository.PreferenceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MatchingService {

  private static final Logger logger = LoggerFactory.getLogger(MatchingService.class);

  private final PreferenceRepository preferenceRepository;
  private final MatchRepository matchRepository;
  private final MatchingMetrics metrics;
  private final Clock clock;

  /**
   * 役割: actor の target に対する判定を記録し、like が相互になればマッチを作成する。
   *
   * <p>期待動作: 判定の挿入と相互判定は別ステートメントで即時コミットする。
   * 同時に相互 like した 2 呼び出しのうち少なくとも一方が相手の like を観測する。
   * 相互判定が失敗した場合は「相互でない」とみなさず StorageUnavailableException を返す。
   * 保存済みの like を再送した場合は相互判定からやり直すため、失敗後の再試行でマッチが確定する。
   */
  public DecisionResult recordDecision(UUID actorId, UUID targetId, Decision decision) {
    Objects.requireNonNull(actorId, "actorId");
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(decision, "decision");
    if (actorId.equals(targetId)) {
      metrics.recordDecision(decision.value(), "invalid_self");
      throw new InvalidSelfActionException();
    }
    try {
      return decide(actorId, targetId, decision);
    } catch (StorageUnavailableException ex) {
      metrics.recordDecision(decision.value(), "storage_unavailable");
      throw ex;
    }
  }

  private DecisionResult decide(UUID actorId, UUID targetId, Decision decision) {
    final Instant now = Instant.now(clock);
    final PreferenceRecord candidate =
        new PreferenceRecord(UUID.randomUUID(), actorId, targetId, decision, now, now);
    final Optional<PreferenceRecord> inserted = preferenceRepository.insertIfAbsent(candidate);
    if (inserted.isEmpty()) {
      return redetect(actorId, targetId, decision, now);
    }
    final PreferenceRecord preference = inserted.get();

    if (decision == Decision.PASS) {
      metrics.recordDecision(decision.value(), "recorded");
      return DecisionResult.unmatched(preference);
    }
    return detectMatch(preference, now)
        .orElseGet(
            () -> {
              metrics.recordDecision(decision.value(), "pending");
              return DecisionResult.unmatched(preference);
            });
  }

  /**
   * 既存の判定がある場合の処理。保存済みの like が相互なら再検出してマッチを返す。
   *
   * <p>like 保存後に相互判定/マッチ作成が失敗した呼び出しの再試行で、マッチを確定させる。
   * それ以外は判定不変として DecisionAlreadyExistsException。
   */
  private DecisionResult redetect(UUID actorId, UUID targetId, Decision decision, Instant now) {
    final Optional<DecisionResult> repaired =
        preferenceRepository
            .findByUserAndTarget(actorId, targetId)
            .filter(stored -> decision == Decision.LIKE && stored.decision() == Decision.LIKE)
            .flatMap(stored -> detectMatch(stored, now));
    if (repaired.isPresent()) {
      return repaired.get();
    }
    metrics.recordDecision(decision.value(), "duplicate");
    logger.info("duplicate decision rejected actorId={} targetId={}", actorId, targetId);
    throw new DecisionAlreadyExistsException();
  }

  /** 相互でなければ空。相互なら作成済み/既存どちらのマッチでも matched を返す。 */
  private Optional<DecisionResult> detectMatch(PreferenceRecord preference, Instant now) {
    final UUID actorId = preference.userId();
    final UUID targetId = preference.targetUserId();
    final Mutuality mutuality = preferenceRepository.checkMutual(actorId, targetId);
    if (mutuality == Mutuality.NOT_MUTUAL) {
      return Optional.empty();
    }

    final MatchCreation creation = matchRepository.createIfAbsent(actorId, targetId, now);
    metrics.recordMatch(creation.created());
    metrics.recordDecision(preference.decision().value(), "matched");
    if (creation.created()) {
      logger.info(
          "match created matchId={} userLow={} userHigh={}",
          creation.match().matchId(),
          creation.match().userLow(),
          creation.match().userHigh());
    } else {
      logger.debug("mutual like converged on existing match matchId={}", creation.match().matchId());
    }
    return Optional.of(DecisionResult.matched(preference, creation.match()));
  }
}
