/*
 * どこで: Matching API
 * 何を: like/pass 作成リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.example.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LikeRequest(
    @NotNull(message = "target_user_id is required") UUID targetUserId,
    @NotBlank(message = "status is required")
        @Pattern(regexp = "(?i)like|pass", message = "status must be like or pass")
        String status) {}
