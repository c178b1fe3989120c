/*
 * どこで: Chat API
 * 何を: マッチのメンバー以外による閲覧拒否(403)を表す例外
 * なぜ: match_id の推測で第三者の会話を読めないようにするため
 */
package com.example.matching.api;

public class NotAMatchMemberException extends RuntimeException {

  public NotAMatchMemberException() {
    super("not authorized to view messages for this match");
  }
}
