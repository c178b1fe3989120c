/*
 * どこで: Matching ドメインモデル
 * 何を: like/pass の判定値を定義する
 * なぜ: API 入力と preferences.status の値を列挙型で固定するため
 */
package com.example.matching.model;

public enum Decision {
  LIKE("like"),
  PASS("pass");

  private final String value;

  Decision(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: API/DB の status 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定し、未対応値は IllegalArgumentException を送出する。
   */
  public static Decision fromValue(String value) {
    for (Decision decision : values()) {
      if (decision.value.equalsIgnoreCase(value)) {
        return decision;
      }
    }
    throw new IllegalArgumentException("unsupported status: " + value);
  }
}
