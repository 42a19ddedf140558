/*
 * どこで: 公平性エンジン
 * 何を: 1 ラウンドの勝敗判定結果を表す
 * なぜ: 第三者検証に必要な値 (seed_slice / 乱数 / 距離) を判定結果と一緒に永続化するため
 */
package com.twos.duel.fairness;

public record RoundOutcome(
    String seedInput,
    String seedSlice,
    long timeSlot,
    int randomNumber,
    int distanceA,
    int distanceB,
    String winnerId,
    boolean draw,
    String formula) {

  /** 0 = A 勝利, 1 = B 勝利, -1 = 引き分け。検証 API の claimed_winner_index と同じ表現。 */
  public int winnerIndex() {
    if (draw) {
      return FairnessEngine.DRAW_INDEX;
    }
    return distanceA < distanceB ? 0 : 1;
  }
}
