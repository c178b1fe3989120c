/*
 * どこで: Matching API
 * 何を: like/pass 作成結果のレスポンスを表す
 * なぜ: 相互 like でマッチが成立したかを 1 回の応答で返すため
 */
package com.example.matching.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LikeResponse(
    PreferenceResponse like,
    boolean matched,
    @JsonInclude(JsonInclude.Include.NON_NULL) MatchResponse match) {}
