/*
 * どこで: Matching API
 * 何を: ユーザープロフィールの出力 DTO
 * なぜ: クライアントに返すユーザー属性を安定した契約として扱うため
 */
package com.example.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserResponse(
    UUID id,
    String name,
    String gender,
    LocalDate birthDate,
    String bio,
    Instant createdAt,
    Instant updatedAt) {}
