/*
 * どこで: Duel ドメインモデル
 * 何を: duel_orders テーブルのスナップショットを表す
 * なぜ: 状態遷移の判定と API 応答で共通化するため
 */
package com.twos.duel.model;

import java.time.Instant;
import java.util.UUID;

public record OrderRecord(
        UUID orderId,
        String ownerId,
        ChipType chipType,
        long stakePerGame,
        int gamesPlanned,
        OrderStatus status,
        String opponentId,
        Instant confirmationDeadline,
        int missedConfirmations,
        UUID matchId,
        long version,
        Instant createdAt,
        Instant updatedAt) {

    // 1 人あたりの拘束額 (作成者と参加者で同額)
    public long totalStake() {
        return stakePerGame * gamesPlanned;
    }
}
