/*
 * どこで: Matching API
 * 何を: PATCH /v1/users/me の入力 DTO
 * なぜ: 更新可能なプロフィール項目を name/bio に限定するため
 */
package com.example.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserPatchRequest(
    @Size(min = 1, max = 255, message = "name must be 1-255 characters") String name,
    String bio) {}
