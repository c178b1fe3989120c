/*
 * どこで: Matching API
 * 何を: マッチ一覧のレスポンスを表す
 * なぜ: user_id と matches を明示的に返すため
 */
package com.example.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchesResponse(UUID userId, List<MatchSummaryResponse> matches) {
  public MatchesResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    matches =
        matches == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(matches));
  }
}
