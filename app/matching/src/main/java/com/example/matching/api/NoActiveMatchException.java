/*
 * どこで: Chat API
 * 何を: マッチが存在しない相手への送信拒否(403)を表す例外
 * なぜ: 片側 like の有無を漏らさずに送信を拒否するため
 */
package com.example.matching.api;

public class NoActiveMatchException extends RuntimeException {

  public NoActiveMatchException() {
    super("no active match found between users");
  }
}
