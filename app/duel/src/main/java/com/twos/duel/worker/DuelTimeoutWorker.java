/*
 * どこで: Duel 期限切れワーカー
 * 何を: スケジュールで期限切れ掃除を起動する
 * なぜ: 締切を過ぎた注文とラウンドを一定間隔で処理するため
 */
package com.twos.duel.worker;

import com.twos.duel.service.DuelTimeoutService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "duel.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class DuelTimeoutWorker {

  private static final Logger logger = LoggerFactory.getLogger(DuelTimeoutWorker.class);

  private final DuelTimeoutService timeoutService;

  @Scheduled(fixedDelayString = "${duel.sweep.poll-interval}")
  public void run() {
    try {
      timeoutService.sweep();
    } catch (RuntimeException ex) {
      logger.warn("duel timeout sweep failed", ex);
    }
  }
}
