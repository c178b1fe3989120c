/*
 * どこで: Matching API
 * 何を: 同一 (actor, target) への 2 回目の判定(409)を表す例外
 * なぜ: 判定は一度きりで上書きしないため
 */
package com.example.matching.api;

public class DecisionAlreadyExistsException extends RuntimeException {

  public DecisionAlreadyExistsException() {
    super("you have already liked or passed this user");
  }
}
