/*
 * どこで: Duel 通知イベント
 * 何を: 対戦の進行を利用者へ伝えるイベントの形を定義する
 * なぜ: NATS 配信とログ出力で同じペイロード形状を使うため
 */
package com.twos.duel.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DuelEvent(
        String eventId,
        DuelEventType eventType,
        String occurredAt,
        String recipientUserId,
        String orderId,
        String matchId,
        Integer roundNumber,
        Map<String, Object> attributes,
        String traceId) {
}
