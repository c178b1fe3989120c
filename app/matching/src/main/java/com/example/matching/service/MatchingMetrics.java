/*
 * どこで: Matching サービス層
 * 何を: 判定/マッチ成立/チャットのアプリ固有メトリクスを集約する
 * なぜ: マッチ成立率とチャット拒否の推移を運用で監視するため
 */
package com.example.matching.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class MatchingMetrics {

  private static final String METRIC_DECISION_TOTAL = "matching.decision.total";
  private static final String METRIC_MATCH_TOTAL = "matching.match.total";
  private static final String METRIC_CHAT_TOTAL = "matching.chat.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public MatchingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordDecision(String decision, String result) {
    increment(
        METRIC_DECISION_TOTAL,
        "Like/pass decisions by outcome",
        Tags.of("decision", decision, "result", result));
  }

  /** created=false は同時検出で既存マッチへ収束したケース。 */
  public void recordMatch(boolean created) {
    increment(
        METRIC_MATCH_TOTAL,
        "Mutual like detections",
        Tags.of("result", created ? "created" : "existing"));
  }

  public void recordChat(String action, String result) {
    increment(
        METRIC_CHAT_TOTAL, "Chat send/read requests", Tags.of("action", action, "result", result));
  }

  private void increment(String name, String description, Tags tags) {
    final String key =
        name
            + tags.stream()
                .map(tag -> tag.getKey() + "=" + tag.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    counters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment();
  }
}
