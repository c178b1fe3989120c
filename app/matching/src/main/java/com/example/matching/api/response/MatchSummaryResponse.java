package com.example.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

/** マッチ一覧の要素。相手のプロフィールが未登録の場合 matched_user は null。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchSummaryResponse(
    UUID id, UUID matchedUserId, UserResponse matchedUser, Instant createdAt) {}
