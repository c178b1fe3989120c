/*
 * どこで: Matching ドメインモデル
 * 何を: preferences テーブルの 1 行(actor から target への判定)を表す
 * なぜ: Repository/Service/API 間で判定内容を受け渡すため
 */
package com.example.matching.model;

import java.time.Instant;
import java.util.UUID;

public record PreferenceRecord(
    UUID id,
    UUID userId,
    UUID targetUserId,
    Decision decision,
    Instant createdAt,
    Instant updatedAt) {}
