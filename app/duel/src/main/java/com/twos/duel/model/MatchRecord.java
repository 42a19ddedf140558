/*
 * どこで: Duel ドメインモデル
 * 何を: duel_matches テーブルのスナップショットを表す
 * なぜ: シリーズの集計値と終了状態をまとめて扱うため
 */
package com.twos.duel.model;

import java.time.Instant;
import java.util.UUID;

public record MatchRecord(
        UUID matchId,
        UUID orderId,
        String playerAId,
        String playerBId,
        long stakePerGame,
        int gamesPlanned,
        int gamesPlayed,
        int winsA,
        int winsB,
        int draws,
        MatchStatus status,
        String winnerId,
        MatchEndReason endReason,
        long version,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt) {

    public boolean isParticipant(String userId) {
        return playerAId.equals(userId) || playerBId.equals(userId);
    }

    public PlayerSide sideOf(String userId) {
        if (playerAId.equals(userId)) {
            return PlayerSide.A;
        }
        if (playerBId.equals(userId)) {
            return PlayerSide.B;
        }
        throw new IllegalArgumentException("not a participant: " + userId);
    }

    public String playerId(PlayerSide side) {
        return side == PlayerSide.A ? playerAId : playerBId;
    }

    public long totalPool() {
        return 2L * stakePerGame * gamesPlanned;
    }
}
