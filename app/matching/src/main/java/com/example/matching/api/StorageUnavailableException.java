/*
 * どこで: Matching API
 * 何を: 一時的なストレージ障害(503)を表す例外
 * なぜ: 「判定できなかった」を「マッチしていない」と区別して呼び出し側へ返すため
 */
package com.example.matching.api;

public class StorageUnavailableException extends RuntimeException {

  private final String operation;

  public StorageUnavailableException(String operation, Throwable cause) {
    super("storage unavailable: " + operation, cause);
    this.operation = operation;
  }

  public String operation() {
    return operation;
  }
}
