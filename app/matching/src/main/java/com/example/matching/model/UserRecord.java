/*
 * どこで: Matching ドメインモデル
 * 何を: users テーブル相当のプロフィールレコード
 * なぜ: マッチ一覧で相手ユーザーの情報を返すため
 */
package com.example.matching.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record UserRecord(
    UUID userId,
    String name,
    Gender gender,
    LocalDate birthDate,
    String bio,
    Instant createdAt,
    Instant updatedAt) {}
