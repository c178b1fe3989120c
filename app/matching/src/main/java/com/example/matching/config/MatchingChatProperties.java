/*
 * どこで: Matching アプリの設定バインド
 * 何を: チャット本文の最大長を保持する
 * なぜ: 本文サイズの上限を環境ごとに調整し、起動時に妥当性を検証するため
 */
package com.example.matching.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "matching.chat")
@Validated
public record MatchingChatProperties(@NotNull @Positive @Max(100_000) Integer maxContentLength) {}
