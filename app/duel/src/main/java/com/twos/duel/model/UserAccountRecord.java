/*
 * どこで: Duel ドメインモデル
 * 何を: duel_users テーブルのスナップショットを表す
 * なぜ: 残高と信頼度カウンタを同じ行で扱うため
 */
package com.twos.duel.model;

import java.time.Instant;

public record UserAccountRecord(
        String userId,
        String username,
        long pointsBalance,
        int totalDeals,
        int completedDeals,
        int missedConfirmations,
        int droppedBeforeMinGames,
        long version,
        Instant createdAt,
        Instant updatedAt) {
}
