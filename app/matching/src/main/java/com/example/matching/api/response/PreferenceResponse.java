package com.example.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PreferenceResponse(
    UUID id,
    UUID userId,
    UUID targetUserId,
    String status,
    Instant createdAt,
    Instant updatedAt) {}
