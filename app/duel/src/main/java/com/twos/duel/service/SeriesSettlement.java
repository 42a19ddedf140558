/*
 * どこで: Duel サービス層
 * 何を: シリーズ終了時の精算内容 (誰にどの種別で何ポイント戻すか) を表す
 * なぜ: 計算と適用を分け、精算ルールを DB なしで検証できるようにするため
 */
package com.twos.duel.service;

import com.twos.duel.model.PlayerSide;
import com.twos.duel.model.TransactionType;
import java.util.List;

public record SeriesSettlement(Kind kind, PlayerSide winner, List<Payout> payouts) {

    public enum Kind {
        NOT_RELEASED,
        WINNER,
        DRAW,
        FORFEIT,
        ABANDONED
    }

    public record Payout(PlayerSide side, TransactionType type, long amount) {}

    public long totalPaidOut() {
        return payouts.stream().mapToLong(Payout::amount).sum();
    }
}
