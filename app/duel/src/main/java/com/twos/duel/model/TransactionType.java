/*
 * どこで: Duel ドメインモデル
 * 何を: ポイント台帳の取引種別を定義する
 * なぜ: 残高の増減理由を後から監査できるようにするため
 */
package com.twos.duel.model;

public enum TransactionType {
    INITIAL_BALANCE,
    POINTS_GRANT,
    STAKE_LOCK,
    STAKE_REFUND,
    DUEL_WIN,
    FORFEIT_AWARD
}
