/*
 * どこで: Matching ドメインモデル
 * 何を: 順序を持たない 2 ユーザーの組を (low, high) の正規形へ変換する
 * なぜ: (A,B) と (B,A) を matches の同一キーへ畳み込むため
 */
package com.example.matching.model;

import java.util.Objects;
import java.util.UUID;

public record CanonicalPair(UUID low, UUID high) {

  public CanonicalPair {
    Objects.requireNonNull(low, "low");
    Objects.requireNonNull(high, "high");
    if (compare(low, high) >= 0) {
      throw new InvalidPairException("low must sort before high");
    }
  }

  /**
   * 役割: 2 つの識別子を正規順序に並べ替える。
   * 動作: 同一識別子は InvalidPairException。引数順に依存せず同じ結果を返す。
   */
  public static CanonicalPair of(UUID first, UUID second) {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    final int order = compare(first, second);
    if (order == 0) {
      throw new InvalidPairException("a pair requires two distinct users");
    }
    return order < 0 ? new CanonicalPair(first, second) : new CanonicalPair(second, first);
  }

  public boolean contains(UUID userId) {
    return low.equals(userId) || high.equals(userId);
  }

  public UUID counterpartOf(UUID userId) {
    if (low.equals(userId)) {
      return high;
    }
    if (high.equals(userId)) {
      return low;
    }
    throw new IllegalArgumentException("user is not a member of the pair");
  }

  // UUID.compareTo は符号付き比較のため使わない。
  // 小文字の正規文字列比較は PostgreSQL の uuid 比較(バイト順)と一致する。
  static int compare(UUID left, UUID right) {
    return left.toString().compareTo(right.toString());
  }
}
