/*
 * どこで: Duel 通知
 * 何を: 対戦イベントの配信口を抽象化する
 * なぜ: NATS の有無で配信実装を切り替え、サービス層を配信手段から切り離すため
 */
package com.twos.duel.service;

import com.twos.duel.model.DuelEvent;
import java.util.concurrent.CompletableFuture;

public interface DuelEventPublisher {

  /**
   * 配信を開始し、完了を待たずに返す。
   *
   * <p>入力不正は RuntimeException で即時に、配信失敗は戻り値の future の異常完了で通知する。
   */
  CompletableFuture<Void> publish(DuelEvent event);
}
