/*
 * どこで: Matching ドメインモデル
 * 何を: matches テーブルの 1 行を表す
 * なぜ: 正規化済みペアと match_id を一緒に扱うため
 */
package com.example.matching.model;

import java.time.Instant;
import java.util.UUID;

public record MatchRecord(
    UUID matchId, UUID userLow, UUID userHigh, Instant createdAt, Instant updatedAt) {

  public CanonicalPair pair() {
    return new CanonicalPair(userLow, userHigh);
  }

  public boolean hasMember(UUID userId) {
    return pair().contains(userId);
  }
}
