/*
 * どこで: Matching API
 * 何を: 自分自身への like/pass(400)を表す例外
 * なぜ: 自己ペアを preferences へ書き込ませないため
 */
package com.example.matching.api;

public class InvalidSelfActionException extends RuntimeException {

  public InvalidSelfActionException() {
    super("cannot like or pass yourself");
  }
}
