/*
 * どこで: Matching API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.matching.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNAUTHENTICATED,
  INVALID_SELF_ACTION,
  INVALID_PAIR,
  DECISION_ALREADY_EXISTS,
  NO_ACTIVE_MATCH,
  NOT_A_MATCH_MEMBER,
  USER_NOT_FOUND,
  USER_ALREADY_EXISTS,
  STORAGE_UNAVAILABLE,
  INTERNAL_ERROR
}
