/*
 * どこで: Duel サービス層
 * 何を: 注文操作/ラウンド確定/期限切れ処理/通知失敗のメトリクス記録を集約する
 * なぜ: 対戦の進行状況とタイムアウト掃除の健全性を運用で継続監視できるようにするため
 */
package com.twos.duel.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DuelMetrics {

  static final String METRIC_ORDER_COMMAND_TOTAL = "duel.order.command.total";
  static final String METRIC_ROUND_RESOLVED_TOTAL = "duel.round.resolved.total";
  static final String METRIC_SERIES_COMPLETED_TOTAL = "duel.series.completed.total";
  static final String METRIC_TIMEOUT_TOTAL = "duel.timeout.total";
  static final String METRIC_NOTIFICATION_FAILED_TOTAL = "duel.notification.failed.total";
  static final String METRIC_SWEEP_DURATION = "duel.sweep.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Timer sweepTimer;

  public DuelMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.sweepTimer =
        Timer.builder(METRIC_SWEEP_DURATION)
            .description("Duration of one timeout sweep pass")
            .register(meterRegistry);
  }

  public void recordOrderCommand(String action, String result) {
    increment(METRIC_ORDER_COMMAND_TOTAL, "Order command executions", "action", action, "result", result);
  }

  public void recordRoundResolved(String outcome) {
    increment(METRIC_ROUND_RESOLVED_TOTAL, "Rounds finished", "outcome", outcome);
  }

  public void recordSeriesCompleted(String endReason) {
    increment(METRIC_SERIES_COMPLETED_TOTAL, "Series finalized", "end_reason", endReason);
  }

  public void recordTimeout(String kind, String result) {
    increment(METRIC_TIMEOUT_TOTAL, "Timeout handler executions", "kind", kind, "result", result);
  }

  public void recordNotificationFailure(String eventType) {
    increment(
        METRIC_NOTIFICATION_FAILED_TOTAL, "Notifications dropped", "event_type", eventType);
  }

  public void recordSweepDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    sweepTimer.record(duration);
  }

  private void increment(String name, String description, String... tagPairs) {
    final String key = name + ":" + String.join(":", tagPairs);
    counters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagPairs))
                    .register(meterRegistry))
        .increment();
  }
}
