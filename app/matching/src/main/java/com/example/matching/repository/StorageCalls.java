/*
 * どこで: Matching データアクセス
 * 何を: 一時的な DB 障害を StorageUnavailableException へ変換する
 * なぜ: 接続断/タイムアウトを業務上の「該当なし」と区別して上位へ伝えるため
 */
package com.example.matching.repository;

import com.example.matching.api.StorageUnavailableException;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

final class StorageCalls {

  private StorageCalls() {}

  // 制約違反などの非一時的な例外はそのまま伝播させる。
  static <T> T call(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (TransientDataAccessException
        | RecoverableDataAccessException
        | DataAccessResourceFailureException ex) {
      throw new StorageUnavailableException(operation, ex);
    }
  }
}
