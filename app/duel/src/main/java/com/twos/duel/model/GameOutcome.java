/*
 * どこで: Duel ドメインモデル
 * 何を: 確定したラウンドの結果種別を定義する
 * なぜ: 通常決着と不戦 (FORFEITED_X は X 側が未提出) を同じ列で区別するため
 */
package com.twos.duel.model;

public enum GameOutcome {
    A_WINS,
    B_WINS,
    DRAW,
    FORFEITED_A,
    FORFEITED_B,
    ABANDONED;

    public boolean isForfeit() {
        return this == FORFEITED_A || this == FORFEITED_B;
    }

    public boolean countsAsWinFor(PlayerSide side) {
        if (side == PlayerSide.A) {
            return this == A_WINS || this == FORFEITED_B;
        }
        return this == B_WINS || this == FORFEITED_A;
    }

    public boolean countsAsDraw() {
        return this == DRAW || this == ABANDONED;
    }
}
