/*
 * どこで: Matching ドメインモデル
 * 何を: 相互 like 判定の結果を表す
 * なぜ: 判定不能(ストレージ障害)を「相互でない」と混同しないため
 */
package com.example.matching.model;

public enum Mutuality {
  MUTUAL,
  NOT_MUTUAL;

  public static Mutuality of(boolean reciprocalLikeExists) {
    return reciprocalLikeExists ? MUTUAL : NOT_MUTUAL;
  }
}
