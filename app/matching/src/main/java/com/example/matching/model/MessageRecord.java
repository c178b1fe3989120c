package com.example.matching.model;

import java.time.Instant;
import java.util.UUID;

public record MessageRecord(
    UUID id, UUID matchId, UUID senderId, UUID receiverId, String content, Instant createdAt) {}
