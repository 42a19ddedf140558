package com.twos.duel.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.twos.duel.model.PlayerSide;
import com.twos.duel.model.TransactionType;
import org.junit.jupiter.api.Test;

class RewardCalculatorTest {

    private final RewardCalculator calculator = new RewardCalculator();

    @Test
    void seriesBelowMinimumGamesIsNotReleased() {
        SeriesSettlement settlement = calculator.settleSeries(new SeriesScore(1, 0, 0, 1, 3), 10L);

        assertThat(settlement.kind()).isEqualTo(SeriesSettlement.Kind.NOT_RELEASED);
        assertThat(settlement.payouts()).isEmpty();
    }

    @Test
    void winnerTakesBothStakes() {
        SeriesSettlement settlement = calculator.settleSeries(new SeriesScore(1, 2, 0, 3, 3), 25L);

        assertThat(settlement.kind()).isEqualTo(SeriesSettlement.Kind.WINNER);
        assertThat(settlement.winner()).isEqualTo(PlayerSide.B);
        assertThat(settlement.payouts())
                .containsExactly(new SeriesSettlement.Payout(PlayerSide.B, TransactionType.DUEL_WIN, 150L));
        assertThat(settlement.totalPaidOut()).isEqualTo(2 * 25L * 3);
    }

    @Test
    void equalWinsRefundEachStake() {
        SeriesSettlement settlement = calculator.settleSeries(new SeriesScore(1, 1, 2, 4, 4), 5L);

        assertThat(settlement.kind()).isEqualTo(SeriesSettlement.Kind.DRAW);
        assertThat(settlement.winner()).isNull();
        assertThat(settlement.payouts()).containsExactly(
                new SeriesSettlement.Payout(PlayerSide.A, TransactionType.STAKE_REFUND, 20L),
                new SeriesSettlement.Payout(PlayerSide.B, TransactionType.STAKE_REFUND, 20L));
    }

    @Test
    void allDrawsRefundBoth() {
        SeriesSettlement settlement = calculator.settleSeries(new SeriesScore(0, 0, 2, 2, 2), 50L);

        assertThat(settlement.kind()).isEqualTo(SeriesSettlement.Kind.DRAW);
        assertThat(settlement.totalPaidOut()).isEqualTo(200L);
    }

    @Test
    void forfeitAwardsPoolToOpponent() {
        SeriesSettlement settlement = calculator.settleForfeit(PlayerSide.A, 10L, 5);

        assertThat(settlement.kind()).isEqualTo(SeriesSettlement.Kind.FORFEIT);
        assertThat(settlement.winner()).isEqualTo(PlayerSide.B);
        assertThat(settlement.payouts())
                .containsExactly(new SeriesSettlement.Payout(PlayerSide.B, TransactionType.FORFEIT_AWARD, 100L));
    }

    @Test
    void abandonmentRefundsBoth() {
        SeriesSettlement settlement = calculator.settleAbandonment(10L, 2);

        assertThat(settlement.kind()).isEqualTo(SeriesSettlement.Kind.ABANDONED);
        assertThat(settlement.payouts()).extracting(SeriesSettlement.Payout::amount).containsExactly(20L, 20L);
    }

    @Test
    void minimumGamesThreshold() {
        assertThat(RewardCalculator.meetsMinimumGames(1)).isFalse();
        assertThat(RewardCalculator.meetsMinimumGames(2)).isTrue();
    }

    @Test
    void rejectsInvalidStakeOrPlannedGames() {
        assertThatThrownBy(() -> calculator.settleSeries(new SeriesScore(2, 0, 0, 2, 2), 0L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> calculator.settleForfeit(PlayerSide.B, 10L, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
