/*
 * どこで: Duel ドメインモデル
 * 何を: duel_games テーブル (1 ラウンド) のスナップショットを表す
 * なぜ: 提出状況と確定済みの公平性結果を型付きで保持するため
 */
package com.twos.duel.model;

import java.time.Instant;
import java.util.UUID;

public record GameRecord(
        UUID gameId,
        UUID matchId,
        int roundNumber,
        GameStatus status,
        Instant startedAt,
        Instant deadline,
        Integer playerANumber,
        Instant playerASubmittedAt,
        Integer playerBNumber,
        Instant playerBSubmittedAt,
        GameOutcome outcome,
        Long timeSlot,
        String seedSlice,
        Integer randomNumber,
        Integer distanceA,
        Integer distanceB,
        String winnerId,
        Instant finishedAt,
        long version) {

    public boolean hasSubmitted(PlayerSide side) {
        return numberOf(side) != null;
    }

    public Integer numberOf(PlayerSide side) {
        return side == PlayerSide.A ? playerANumber : playerBNumber;
    }

    public boolean isFinished() {
        return status == GameStatus.FINISHED;
    }
}
