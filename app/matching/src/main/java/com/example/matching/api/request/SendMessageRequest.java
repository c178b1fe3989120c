/*
 * どこで: Chat API
 * 何を: メッセージ送信リクエストの入力を保持する
 * なぜ: match_id/receiver_id/content の必須検証を宣言的に行うため
 */
package com.example.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendMessageRequest(
    @NotNull(message = "match_id is required") UUID matchId,
    @NotNull(message = "receiver_id is required") UUID receiverId,
    @NotBlank(message = "content is required") String content) {}
