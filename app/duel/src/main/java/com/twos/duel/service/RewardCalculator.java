/*
 * どこで: Duel サービス層
 * 何を: シリーズの勝敗・引き分け・不戦・放棄に応じた拘束ポイントの払い出しを計算する
 * なぜ: 2 人分の拘束額がどの終わり方でも過不足なく 1 回だけ払い出されるようにするため
 */
package com.twos.duel.service;

import com.twos.duel.model.PlayerSide;
import com.twos.duel.model.TransactionType;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class RewardCalculator {

    public static final int MIN_GAMES_REQUIRED = 2;

    public static boolean meetsMinimumGames(int completedGames) {
        return completedGames >= MIN_GAMES_REQUIRED;
    }

    /**
     * 役割: 全ラウンド終了後の払い出しを決める。
     * 動作: 勝ち数の多い側に 2 人分の拘束額を払い、同数なら各自へ自分の拘束額を返す。
     *       規定試合数に満たない場合は NOT_RELEASED を返し、呼び出し側はシリーズを継続する。
     */
    public SeriesSettlement settleSeries(SeriesScore score, long stakePerGame) {
        validate(stakePerGame, score.gamesPlanned());
        if (!meetsMinimumGames(score.gamesPlayed())) {
            return new SeriesSettlement(SeriesSettlement.Kind.NOT_RELEASED, null, List.of());
        }
        long ownStake = stakePerGame * score.gamesPlanned();
        if (score.winsA() == score.winsB()) {
            return new SeriesSettlement(SeriesSettlement.Kind.DRAW, null, List.of(
                    new SeriesSettlement.Payout(PlayerSide.A, TransactionType.STAKE_REFUND, ownStake),
                    new SeriesSettlement.Payout(PlayerSide.B, TransactionType.STAKE_REFUND, ownStake)));
        }
        PlayerSide winner = score.winsA() > score.winsB() ? PlayerSide.A : PlayerSide.B;
        return new SeriesSettlement(SeriesSettlement.Kind.WINNER, winner, List.of(
                new SeriesSettlement.Payout(winner, TransactionType.DUEL_WIN, 2 * ownStake)));
    }

    // 規定試合数に達する前の離脱は、相手に 2 人分の拘束額を渡して終了する
    public SeriesSettlement settleForfeit(PlayerSide forfeiter, long stakePerGame, int gamesPlanned) {
        validate(stakePerGame, gamesPlanned);
        PlayerSide winner = forfeiter.opponent();
        long pool = 2 * stakePerGame * gamesPlanned;
        return new SeriesSettlement(SeriesSettlement.Kind.FORFEIT, winner, List.of(
                new SeriesSettlement.Payout(winner, TransactionType.FORFEIT_AWARD, pool)));
    }

    public SeriesSettlement settleAbandonment(long stakePerGame, int gamesPlanned) {
        validate(stakePerGame, gamesPlanned);
        long ownStake = stakePerGame * gamesPlanned;
        return new SeriesSettlement(SeriesSettlement.Kind.ABANDONED, null, List.of(
                new SeriesSettlement.Payout(PlayerSide.A, TransactionType.STAKE_REFUND, ownStake),
                new SeriesSettlement.Payout(PlayerSide.B, TransactionType.STAKE_REFUND, ownStake)));
    }

    private void validate(long stakePerGame, int gamesPlanned) {
        if (stakePerGame <= 0) {
            throw new IllegalArgumentException("stakePerGame must be positive");
        }
        if (gamesPlanned < MIN_GAMES_REQUIRED) {
            throw new IllegalArgumentException("gamesPlanned must be at least " + MIN_GAMES_REQUIRED);
        }
    }
}
