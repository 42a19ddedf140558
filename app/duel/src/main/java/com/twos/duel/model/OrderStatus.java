/*
 * どこで: Duel ドメインモデル
 * 何を: 注文の状態を定義する
 * なぜ: 状態遷移と永続化の整合性を保つため
 */
package com.twos.duel.model;

public enum OrderStatus {
    OPEN,
    WAITING_CREATOR_CONFIRM,
    MATCHED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == EXPIRED;
    }
}
